/**
 * Per-stream subscriber bookkeeping shared by the watcher facade and its worker thread.
 */
package io.eventwatch.registry;
