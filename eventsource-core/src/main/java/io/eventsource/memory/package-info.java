/**
 * Non-durable store implementations for tests and single-process use.
 */
package io.eventsource.memory;
