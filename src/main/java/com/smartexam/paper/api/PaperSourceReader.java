package com.smartexam.paper.api;

import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads uploaded paper and syllabus text. The only place where the service touches a stream.
 */
@Component
public class PaperSourceReader {

    public String read(MultipartFile file) {
        if (file == null || file.isEmpty()) return "";
        try (InputStream in = file.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PaperSourceException("Cannot read uploaded file " + file.getOriginalFilename(), e);
        }
    }
}
