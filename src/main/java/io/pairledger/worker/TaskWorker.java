package io.pairledger.worker;

public interface TaskWorker {
    String id();

    WorkResult perform(WorkContext context) throws Exception;
}
