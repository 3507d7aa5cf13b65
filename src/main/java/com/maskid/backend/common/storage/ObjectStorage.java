package com.maskid.backend.common.storage;

import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * 檔案存放的窄介面：頭像、client icon 都走這裡。
 * path 是存進 DB 的相對路徑，URL 一律在讀取時才解析。
 */
public interface ObjectStorage {

    /** @return 存進 files.path 的相對路徑 */
    String save(String folder, MultipartFile file, String ext) throws IOException;

    String resolveUrl(String path);
}
