/**
 * Maps exceptions thrown at the REST boundary to {@code ApiError} responses.
 */
package com.phillippitts.meetingscribe.presentation.exception;
