package io.eventsource.spi;

/**
 * Runs a block of store writes as one atomic unit.
 *
 * <p>The projection engine wraps "apply event to read model" and "advance checkpoint"
 * in a single unit so a crash can never leave the checkpoint ahead of the read model.
 * The JDBC implementation binds one transaction to the calling thread.
 *
 * @see #DIRECT
 */
@FunctionalInterface
public interface UnitOfWork {

  /**
   * Runs the work without any transaction. Suitable for in-memory stores.
   */
  UnitOfWork DIRECT = Work::run;

  /**
   * Executes the work; commits if it completes normally, rolls back if it throws.
   *
   * @param work the block to run
   * @throws Exception whatever the work throws, after rollback
   */
  void execute(Work work) throws Exception;

  @FunctionalInterface
  interface Work {
    void run() throws Exception;
  }
}
