package com.example.querygate.util;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;

/**
 * Locates files that live next to the server jar (or the classes directory when run from an IDE).
 */
public final class InstallLocation {

    private InstallLocation() {
    }

    public static Path directoryOf(Class<?> anchor) {
        CodeSource codeSource = anchor.getProtectionDomain().getCodeSource();
        URL location = codeSource == null ? null : codeSource.getLocation();
        if (location == null) {
            return null;
        }
        Path path;
        try {
            path = Paths.get(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (Files.isRegularFile(path)) {
            return path.getParent();
        }
        return Files.isDirectory(path) ? path : null;
    }

    /**
     * Path of {@code fileName} in the install directory, or {@code null} if that directory is unknown.
     */
    public static Path resolve(Class<?> anchor, String fileName) {
        Path directory = directoryOf(anchor);
        return directory == null ? null : directory.resolve(fileName);
    }
}
