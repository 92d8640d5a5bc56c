/**
 * Structured-logging helpers: Log4j2 ThreadContext keys for connection, session and meeting
 * correlation.
 */
package com.phillippitts.graphicrecorder.config.logging;
