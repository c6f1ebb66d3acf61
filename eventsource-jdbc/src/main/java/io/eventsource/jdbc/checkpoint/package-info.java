/**
 * JDBC projection checkpoint storage.
 */
package io.eventsource.jdbc.checkpoint;
