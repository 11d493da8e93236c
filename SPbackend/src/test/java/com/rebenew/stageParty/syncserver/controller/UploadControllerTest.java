package com.rebenew.stageParty.syncserver.controller;

import com.rebenew.stageParty.syncserver.config.StageProperties;
import com.rebenew.stageParty.syncserver.exception.GlobalExceptionHandler;
import com.rebenew.stageParty.syncserver.service.AudioUploadService;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class UploadControllerTest {

    @TempDir
    Path uploads;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        StageProperties properties = new StageProperties();
        properties.getUploads().setDirectory(uploads);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new UploadController(new AudioUploadService(properties)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void uploadedFileCanBeFetchedBack() throws Exception {
        byte[] audio = "fake mp3 bytes".getBytes(StandardCharsets.UTF_8);
        MockMultipartFile file = new MockMultipartFile("file", "my song.mp3", "audio/mpeg", audio);

        MvcResult result = mockMvc.perform(multipart("/rooms/upload-audio").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.fileUrl", startsWith("/rooms/uploads/")))
                .andExpect(jsonPath("$.filename", endsWith("_my_song.mp3")))
                .andReturn();

        String filename = JsonPath.read(result.getResponse().getContentAsString(), "$.filename");
        assertThat(uploads.resolve(filename)).exists();

        mockMvc.perform(get("/rooms/uploads/" + filename))
                .andExpect(status().isOk())
                .andExpect(content().bytes(audio));
    }

    @Test
    void emptyUploadIsABadRequest() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.mp3", "audio/mpeg", new byte[0]);

        mockMvc.perform(multipart("/rooms/upload-audio").file(empty))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No file uploaded"));
    }

    @Test
    void missingFileIsA404() throws Exception {
        mockMvc.perform(get("/rooms/uploads/nothing.mp3"))
                .andExpect(status().isNotFound());
    }
}
