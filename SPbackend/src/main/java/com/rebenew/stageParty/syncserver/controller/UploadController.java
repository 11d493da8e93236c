package com.rebenew.stageParty.syncserver.controller;

import com.rebenew.stageParty.syncserver.service.AudioUploadService;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/rooms")
public class UploadController {

    static final String UPLOADS_PATH = "/rooms/uploads/";

    private final AudioUploadService uploadService;

    public UploadController(AudioUploadService uploadService) {
        this.uploadService = uploadService;
    }

    // El host sube el audio; la audiencia lo carga desde fileUrl
    @PostMapping(value = "/upload-audio", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> upload(@RequestParam("file") MultipartFile file) {
        String filename = uploadService.store(file);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("fileUrl", UPLOADS_PATH + filename);
        body.put("filename", filename);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/uploads/{filename:.+}")
    public ResponseEntity<Resource> download(@PathVariable String filename) {
        Resource resource = uploadService.load(filename);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(uploadService.contentType(filename)))
                .body(resource);
    }
}
