/**
 * Client-side recording saga: decides when local capture runs and keeps the server's
 * session in step with it.
 */
package com.phillippitts.graphicrecorder.client.recording;
