package org.autofetch.schedule;

public class EmptyQueueException extends IllegalStateException {

    public EmptyQueueException() {
        super("Trigger queue is empty");
    }
}
