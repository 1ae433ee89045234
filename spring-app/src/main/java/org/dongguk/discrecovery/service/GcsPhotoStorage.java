package org.dongguk.discrecovery.service;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class GcsPhotoStorage implements PhotoStorage {
    private final Storage storage;

    @Value("${cloud.storage.bucket}")
    private String BUCKET_NAME;

    @Override
    public StoredPhoto upload(String storagePath, byte[] content, String contentType) {
        BlobInfo blobInfo = BlobInfo.newBuilder(BUCKET_NAME, storagePath)
                .setContentType(contentType)
                .build();
        storage.create(blobInfo, content);
        log.info("사진 업로드: bucket={}, path={}", BUCKET_NAME, storagePath);

        return new StoredPhoto(
                String.format("https://storage.googleapis.com/%s/%s", BUCKET_NAME, storagePath),
                storagePath
        );
    }

    @Override
    public void delete(String storagePath) {
        boolean deleted = storage.delete(BlobId.of(BUCKET_NAME, storagePath));
        if (!deleted) {
            log.warn("삭제할 사진이 없습니다: bucket={}, path={}", BUCKET_NAME, storagePath);
        }
    }
}
