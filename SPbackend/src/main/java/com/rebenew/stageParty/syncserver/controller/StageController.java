package com.rebenew.stageParty.syncserver.controller;

import com.rebenew.stageParty.syncserver.core.MemberRegistry;
import com.rebenew.stageParty.syncserver.core.StageRegistry;
import com.rebenew.stageParty.syncserver.model.StageSummary;
import com.rebenew.stageParty.syncserver.service.PublicDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vista REST de solo lectura de los stages. Todo lo que modifica un stage pasa por el WebSocket.
 * <p>
 * Los clientes consultan {@code /rooms/public} mientras su socket está caído.
 */
@RestController
@RequestMapping("/rooms")
public class StageController {
    private static final Logger logger = LoggerFactory.getLogger(StageController.class);

    private final StageRegistry stageRegistry;
    private final MemberRegistry memberRegistry;
    private final PublicDirectory publicDirectory;

    public StageController(StageRegistry stageRegistry, MemberRegistry memberRegistry,
                           PublicDirectory publicDirectory) {
        this.stageRegistry = stageRegistry;
        this.memberRegistry = memberRegistry;
        this.publicDirectory = publicDirectory;
    }

    @GetMapping("/public")
    public List<StageSummary> publicStages() {
        return publicDirectory.list();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("timestamp", System.currentTimeMillis());
        body.put("service", "stage-party-sync");
        body.put("activeRooms", stageRegistry.size());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stages", stageRegistry.size());
        body.put("publicStages", stageRegistry.publicCount());
        body.put("members", memberRegistry.size());
        body.put("connectedMembers", memberRegistry.connectedCount());
        return ResponseEntity.ok(body);
    }

    /**
     * {@code ws} queda fuera del patrón: {@code /rooms/ws} es el handshake del WebSocket y
     * este mapping se evalúa antes que el de WebSocket.
     *
     * @return el resumen del stage, 404 vía el exception handler si no existe
     */
    @GetMapping("/{stageId:(?!ws$).+}")
    public StageSummary getStage(@PathVariable String stageId) {
        logger.debug("🔍 Looking up stage {}", stageId);
        return stageRegistry.require(stageId).summary();
    }
}
