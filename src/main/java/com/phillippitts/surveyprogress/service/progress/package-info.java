/**
 * Survey session progress: a single-writer command queue per session and latest-value
 * observables of the session's current question.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.surveyprogress.service.progress.SurveyProgressController} - public entry
 *       point; starts sessions, submits commands, exposes observables</li>
 *   <li>{@link com.phillippitts.surveyprogress.service.progress.ControllerCommand} - sealed set of commands
 *       a session worker can apply</li>
 *   <li>{@link com.phillippitts.surveyprogress.service.progress.ResultCell} - latest-value broadcast holder
 *       of an {@link com.phillippitts.surveyprogress.domain.AsyncResult}</li>
 * </ul>
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Single writer:</b> session state is mutated only by the worker draining its queue;
 *       mutual exclusion is structural, not lock-based</li>
 *   <li><b>Latest value:</b> observers read the current value, never a history (Reactor replay-latest sinks)</li>
 *   <li><b>Session fencing:</b> commands carry their session id and are dropped once superseded</li>
 *   <li><b>Fail-Safe:</b> faults become {@code Failure} results; the worker never dies</li>
 * </ul>
 *
 * @since 0.1
 */
package com.phillippitts.surveyprogress.service.progress;
