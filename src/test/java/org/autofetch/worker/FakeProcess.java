package org.autofetch.worker;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CountDownLatch;

/**
 * Process stand-in whose exit is controlled by the test.
 */
public class FakeProcess extends Process {

    private final long pid;
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile Integer exitCode;
    private volatile boolean statusUnreadable;

    public FakeProcess(long pid) {
        this.pid = pid;
    }

    public static FakeProcess finished(long pid, int exitCode) {
        FakeProcess process = new FakeProcess(pid);
        process.finish(exitCode);
        return process;
    }

    public void finish(int code) {
        exitCode = code;
        exited.countDown();
    }

    /** Reports "not alive" while exitValue() still throws, like a half-reaped child. */
    public void setStatusUnreadable(boolean unreadable) {
        statusUnreadable = unreadable;
    }

    @Override
    public boolean isAlive() {
        return exitCode == null && !statusUnreadable;
    }

    @Override
    public int exitValue() {
        if (exitCode == null || statusUnreadable) {
            throw new IllegalThreadStateException("process hasn't exited");
        }
        return exitCode;
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode;
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public OutputStream getOutputStream() {
        return OutputStream.nullOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public InputStream getErrorStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public void destroy() {
    }
}
