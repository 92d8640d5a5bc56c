/**
 * Presentation layer: the WebSocket endpoint, the HTTP media endpoints and exception mapping.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.ws} - recording WebSocket endpoint and inbound frame routing</li>
 *   <li>{@code presentation.controller} - media and liveness endpoints</li>
 *   <li>{@code presentation.exception} - exception-to-HTTP mapping</li>
 * </ul>
 *
 * <p>Presentation depends on service, never the other way round. Handlers are thin adapters
 * and leave validation to the use cases.
 */
package com.phillippitts.graphicrecorder.presentation;
