package com.kmg.blend.service;

import com.kmg.blend.config.BlendProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class InputScanner {
    private final Set<String> extensions;

    @Autowired
    public InputScanner(BlendProperties properties) {
        this(properties.getSource().getExtensions());
    }

    public InputScanner(Set<String> extensions) {
        this.extensions = extensions.stream()
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public List<Path> listVideos(Path sourceDir) {
        try (Stream<Path> stream = Files.list(sourceDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list videos in " + sourceDir, e);
        }
    }

    public boolean isSupported(Path path) {
        String name = path.getFileName().toString();
        int idx = name.lastIndexOf('.');
        if (idx < 0) {
            return false;
        }
        return extensions.contains(name.substring(idx + 1).toLowerCase(Locale.ROOT));
    }

    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int idx = name.lastIndexOf('.');
        return idx > 0 ? name.substring(0, idx) : name;
    }
}
