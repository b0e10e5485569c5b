/**
 * HTTP presentation layer.
 */
package com.phillippitts.meetingscribe.presentation;
