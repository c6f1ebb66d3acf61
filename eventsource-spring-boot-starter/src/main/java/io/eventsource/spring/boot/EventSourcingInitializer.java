package io.eventsource.spring.boot;

/**
 * Schema step run once by the {@link io.eventsource.EventSourcing} bean after the event
 * and checkpoint tables exist, and only when {@code eventsource.initialize-schema} is on.
 * Read-model stores register one to create their tables.
 */
@FunctionalInterface
public interface EventSourcingInitializer {

    void initialize();
}
