package com.rebenew.stageParty.syncserver.core;

import com.rebenew.stageParty.syncserver.exception.StageException;
import com.rebenew.stageParty.syncserver.model.StageSummary;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Tabla de stages activos, una por proceso.
 */
@Component
public class StageRegistry {

    private final Map<String, Stage> stages = new ConcurrentHashMap<>();

    public void register(Stage stage) {
        Stage previous = stages.putIfAbsent(stage.getId(), stage);
        if (previous != null) {
            throw new IllegalStateException("Stage id already registered: " + stage.getId());
        }
    }

    public Optional<Stage> find(String stageId) {
        if (stageId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(stages.get(stageId));
    }

    public Stage require(String stageId) {
        return find(stageId).orElseThrow(() -> StageException.notFound("Stage not found"));
    }

    public void remove(String stageId) {
        stages.remove(stageId);
    }

    public Collection<Stage> all() {
        return List.copyOf(stages.values());
    }

    // Directorio público, los más recientes primero
    public List<StageSummary> publicSummaries() {
        return stages.values().stream()
                .filter(Stage::isPublic)
                .map(Stage::summary)
                .sorted(Comparator.comparingLong(StageSummary::createdAt).reversed())
                .collect(Collectors.toList());
    }

    public int size() {
        return stages.size();
    }

    public long publicCount() {
        return stages.values().stream().filter(Stage::isPublic).count();
    }
}
