/**
 * Global exception handling for HTTP responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.graphicrecorder.exception.DomainException} → 400 Bad Request,
 *       404 Not Found for a missing meeting or media item</li>
 *   <li>{@link com.phillippitts.graphicrecorder.exception.StorageException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "MEETING_NOT_FOUND",
 *   "message": "Meeting not found",
 *   "details": null,
 *   "timestamp": "2026-03-02T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.graphicrecorder.presentation.exception;
