package com.astrophot.service;

import com.astrophot.model.PixelFrame;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

public class FitsFrameSource implements FrameSource {

    private final List<File> files;
    private final FitsFrameService fitsService;

    public FitsFrameSource(List<File> files, FitsFrameService fitsService) {
        this.files = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(files, "files")));
        this.fitsService = Objects.requireNonNull(fitsService, "fitsService");
    }

    // Todos los .fit/.fits/.fts de una carpeta, por nombre
    public static FitsFrameSource fromDirectory(File dir, FitsFrameService fitsService) throws IOException {
        File[] found = dir.listFiles((d, name) -> isFits(name));
        if (found == null) throw new IOException("No es una carpeta legible: " + dir);
        Arrays.sort(found, Comparator.comparing(File::getName));
        return new FitsFrameSource(Arrays.asList(found), fitsService);
    }

    static boolean isFits(String name) {
        String n = name.toLowerCase();
        return n.endsWith(".fit") || n.endsWith(".fits") || n.endsWith(".fts");
    }

    public List<File> getFiles() { return files; }

    @Override
    public int size() { return files.size(); }

    @Override
    public PixelFrame load(int index) throws IOException {
        return fitsService.read(files.get(index));
    }
}
