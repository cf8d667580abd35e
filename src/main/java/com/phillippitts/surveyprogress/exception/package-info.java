/**
 * Survey progress exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.surveyprogress.exception.SurveyProgressException} - Base exception</li>
 *   <li>{@link com.phillippitts.surveyprogress.exception.SessionNotInitializedException} - No session
 *       started, or its state not created yet</li>
 *   <li>{@link com.phillippitts.surveyprogress.exception.CommandSubmissionException} - A command could
 *       not be enqueued</li>
 *   <li>{@link com.phillippitts.surveyprogress.exception.UnsupportedCommandException} - A reserved
 *       command reached the worker</li>
 * </ul>
 *
 * <p>None of these cross the controller's public boundary as thrown exceptions; they travel as the
 * error of a {@link com.phillippitts.surveyprogress.domain.AsyncResult.Failure}.
 *
 * @since 0.1
 */
package com.phillippitts.surveyprogress.exception;
