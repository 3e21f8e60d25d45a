package com.astrophot.service;

import com.astrophot.model.PhotometryConfig;
import com.astrophot.model.PhotometryException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

public final class Workers {

    private Workers() {}

    public static ExecutorService newPool() {
        return newPool(PhotometryConfig.getWorkerThreads());
    }

    public static ExecutorService newPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "calib-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // Un único hilo para una sesión: los frames de una sesión nunca se procesan a la vez
    static ExecutorService newSessionExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "photometry-session");
            t.setDaemon(true);
            return t;
        });
    }

    // Espera todos los resultados en orden; propaga el primer fallo y cancela el resto
    static <T> List<T> awaitAll(List<? extends Future<T>> futures) {
        List<T> results = new ArrayList<>(futures.size());
        try {
            for (Future<T> f : futures) results.add(f.get());
            return results;
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new PhotometryException("Trabajo en paralelo interrumpido", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new PhotometryException("Fallo en un worker: " + cause.getMessage(), cause);
        }
    }
}
