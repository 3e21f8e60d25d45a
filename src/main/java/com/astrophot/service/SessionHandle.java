package com.astrophot.service;

import com.astrophot.model.PhotometryException;
import com.astrophot.model.PhotometryRecord;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

public final class SessionHandle {

    private final Future<List<PhotometryRecord>> future;
    private final AtomicBoolean cancelled;

    SessionHandle(Future<List<PhotometryRecord>> future, AtomicBoolean cancelled) {
        this.future = future;
        this.cancelled = cancelled;
    }

    public void cancel() { cancelled.set(true); }

    public boolean isCancelled() { return cancelled.get(); }

    public boolean isDone() { return future.isDone(); }

    public List<PhotometryRecord> await() throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new PhotometryException("La sesion termino con error: " + cause.getMessage(), cause);
        }
    }
}
