/**
 * Immutable records exchanged between the store, the checkpoint store and the
 * projection engine.
 */
package io.eventsource.model;
