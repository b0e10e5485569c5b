/**
 * REST controllers.
 */
package com.phillippitts.meetingscribe.presentation.controller;
