/**
 * The recording WebSocket endpoint. Text frames carry JSON control messages, binary frames
 * carry raw audio.
 */
package com.phillippitts.graphicrecorder.presentation.ws;
