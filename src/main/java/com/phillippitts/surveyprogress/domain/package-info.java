/**
 * Immutable domain model for survey sessions.
 *
 * <p>Contains the question and answer value types plus {@link com.phillippitts.surveyprogress.domain.AsyncResult},
 * the tri-state value carried by every observable the progress controller exposes.
 *
 * @since 0.1
 */
package com.phillippitts.surveyprogress.domain;
