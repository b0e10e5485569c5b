/**
 * PCM audio format constants and sample conversions shared by ingestion and the gateways.
 */
package com.phillippitts.meetingscribe.service.audio;
