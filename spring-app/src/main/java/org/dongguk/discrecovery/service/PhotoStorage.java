package org.dongguk.discrecovery.service;

/**
 * 드롭오프 사진 저장소
 */
public interface PhotoStorage {

    StoredPhoto upload(String storagePath, byte[] content, String contentType);

    void delete(String storagePath);

    record StoredPhoto(String url, String storagePath) {
    }
}
