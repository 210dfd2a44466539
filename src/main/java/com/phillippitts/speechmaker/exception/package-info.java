/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.speechmaker.exception.SpeechMakerException}, which carries an optional raw
 * error code from {@link com.phillippitts.speechmaker.exception.ErrorCodes}. Raw failures are turned
 * into user-facing error records by the error classifier; once classified they travel as
 * {@link com.phillippitts.speechmaker.exception.ClassifiedException}.
 *
 * @see com.phillippitts.speechmaker.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.speechmaker.exception;
