package com.playmarket.ecommerce.infrastructure.storage;

import com.playmarket.ecommerce.domain.storage.FileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 로컬 디스크 업로드 디렉터리 기반 FileStorage
 *
 * 업로드 디렉터리 밖을 가리키는 경로와 파일 시스템이 허용하지 않는 경로는 삭제하지 않는다.
 * 삭제 실패는 로그만 남기고 호출자에게 전파하지 않는다.
 */
@Component
public class LocalFileStorage implements FileStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalFileStorage.class);

    private final Path uploadRoot;

    public LocalFileStorage(@Value("${playmarket.storage.upload-dir}") String uploadDir) {
        this.uploadRoot = Paths.get(uploadDir).toAbsolutePath().normalize();
    }

    @Override
    public void deleteFile(String path) {
        if (path == null || path.isBlank()) {
            return;
        }

        Path target;
        try {
            target = uploadRoot.resolve(relativeToUploadRoot(path)).normalize();
        } catch (InvalidPathException e) {
            log.warn("[LocalFileStorage] 잘못된 경로는 삭제하지 않음 - path={}, error={}", path, e.getMessage());
            return;
        }
        if (!target.startsWith(uploadRoot) || target.equals(uploadRoot)) {
            log.warn("[LocalFileStorage] 업로드 디렉터리 밖의 경로는 삭제하지 않음 - path={}", path);
            return;
        }

        try {
            boolean deleted = Files.deleteIfExists(target);
            log.info("[LocalFileStorage] 파일 삭제 - path={}, deleted={}", target, deleted);
        } catch (IOException e) {
            log.warn("[LocalFileStorage] 파일 삭제 실패 - path={}, error={}", target, e.getMessage());
        }
    }

    /**
     * "/uploads/a.jpg", "uploads/a.jpg", "a.jpg" 모두 업로드 디렉터리의 a.jpg
     */
    private String relativeToUploadRoot(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        Path rootName = uploadRoot.getFileName();
        if (rootName != null && normalized.startsWith(rootName + "/")) {
            normalized = normalized.substring(rootName.toString().length() + 1);
        }
        return normalized;
    }
}
