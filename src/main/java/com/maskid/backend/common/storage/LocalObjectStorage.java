package com.maskid.backend.common.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

@Service
public class LocalObjectStorage implements ObjectStorage {
    private static final Logger log = LoggerFactory.getLogger(LocalObjectStorage.class);

    /** URL 前綴，對應 WebConfig 的靜態資源 mapping */
    public static final String PUBLIC_PREFIX = "/static/files/";

    private final Path root;
    private final String publicUrl;

    public LocalObjectStorage(
            @Value("${app.storage.dir:uploads/files}") String dir,
            @Value("${app.public-url:http://localhost:8080}") String publicUrl
    ) throws IOException {
        this.root = Paths.get(dir).toAbsolutePath().normalize();
        this.publicUrl = stripTrailingSlash(publicUrl);
        Files.createDirectories(root);
        log.info("Object storage dir = {}", root.toAbsolutePath());
    }

    /** 路徑：<folder>/<uuid>.<ext> */
    @Override
    public String save(String folder, MultipartFile file, String ext) throws IOException {
        if (folder == null || folder.isBlank() || folder.contains("..")) {
            throw new IllegalArgumentException("FOLDER_INVALID");
        }
        Path dir = root.resolve(folder).normalize();
        if (!dir.startsWith(root)) throw new IllegalArgumentException("FOLDER_INVALID");
        Files.createDirectories(dir);

        String name = UUID.randomUUID() + "." + ext;
        Path dst = dir.resolve(name).normalize();
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, dst, StandardCopyOption.REPLACE_EXISTING);
        }
        return folder + "/" + name;
    }

    @Override
    public String resolveUrl(String path) {
        if (path == null || path.isBlank()) return null;
        String p = path.startsWith("/") ? path.substring(1) : path;
        return publicUrl + PUBLIC_PREFIX + p;
    }

    public Path root() {
        return root;
    }

    private static String stripTrailingSlash(String s) {
        if (s == null) return "";
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
