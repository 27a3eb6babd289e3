package com.playmarket.ecommerce.domain.storage;

/**
 * 업로드 파일 저장소 (Port)
 *
 * 삭제 실패는 호출자에게 전파하지 않는다.
 */
public interface FileStorage {

    void deleteFile(String path);
}
