/**
 * Internal helpers shared by the store modules.
 */
package io.eventsource.util;
