/**
 * Immutable domain records shared by the WebSocket layer, the session orchestration and
 * persistence.
 */
package com.phillippitts.graphicrecorder.domain;
