/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.graphicrecorder.exception.GraphicRecorderException} - Base exception</li>
 *   <li>{@link com.phillippitts.graphicrecorder.exception.DomainException} - Client request rejected;
 *       carries an {@link com.phillippitts.graphicrecorder.exception.ErrorCode} sent back on the
 *       {@code error} frame</li>
 *   <li>{@link com.phillippitts.graphicrecorder.exception.TranscriptionException} - Transcription leg
 *       failed to open or broke mid-stream</li>
 *   <li>{@link com.phillippitts.graphicrecorder.exception.ProviderException} - Analysis, image or
 *       meta-summary provider failure</li>
 *   <li>{@link com.phillippitts.graphicrecorder.exception.StorageException} - Persistence failure</li>
 * </ul>
 *
 * <p>Over WebSocket the {@code MessageRouter} renders these as {@code error} frames; over HTTP the
 * {@code GlobalExceptionHandler} maps them to status codes. Messages of non-domain exceptions are
 * passed through {@code ErrorSanitizer} before they reach a client.
 *
 * @see com.phillippitts.graphicrecorder.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.graphicrecorder.exception;
