package com.ryuqq.contentflow.adapter.filesystem.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.contentflow.core.snapshot.PersistenceResult;
import com.ryuqq.contentflow.core.snapshot.SnapshotLoad;
import com.ryuqq.contentflow.core.snapshot.WorkflowSnapshot;
import com.ryuqq.contentflow.core.spi.SnapshotStore;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON 파일 기반 스냅샷 저장소.
 *
 * <p>실행 하나당 {@code .workflow_state_<session_id>.json} 파일 하나를 사용합니다.
 * 저장은 형제 임시 파일에 기록한 뒤 rename하므로, 크래시가 나도 온전한 스냅샷 하나가 남습니다.</p>
 *
 * <p><strong>실패 처리:</strong> 어떤 메서드도 예외를 던지지 않습니다.</p>
 * <ul>
 *   <li>저장/삭제 실패: WARN 로그 + {@link PersistenceResult.Degraded}</li>
 *   <li>파일 없음: {@link SnapshotLoad.Missing}</li>
 *   <li>읽기 실패, JSON 손상: {@link SnapshotLoad.Unreadable}</li>
 *   <li>알 수 없는 state 값: {@link SnapshotLoad.UnrecognizedState}</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class JsonSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JsonSnapshotStore.class);

    private final ObjectMapper objectMapper;

    public JsonSnapshotStore() {
        this(new ObjectMapper());
    }

    /**
     * 생성자.
     *
     * @param objectMapper JSON 직렬화에 사용할 ObjectMapper
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public JsonSnapshotStore(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    @Override
    public PersistenceResult save(Path path, WorkflowSnapshot snapshot) {
        if (path == null || snapshot == null) {
            throw new IllegalArgumentException("path and snapshot cannot be null");
        }
        try {
            writeJsonAtomic(path, SnapshotCodec.encode(snapshot));
            log.debug("Snapshot saved: {} (state={})", path, snapshot.state().wireValue());
            return new PersistenceResult.Persisted(path);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to save workflow snapshot {}: {}", path, e.getMessage());
            return new PersistenceResult.Degraded(path, describe(e));
        }
    }

    @Override
    public SnapshotLoad load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return new SnapshotLoad.Missing(path);
        } catch (IOException e) {
            log.warn("Failed to read workflow snapshot {}: {}", path, e.getMessage());
            return new SnapshotLoad.Unreadable(path, describe(e));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Corrupt workflow snapshot {}: {}", path, e.getOriginalMessage());
            return new SnapshotLoad.Unreadable(path, "invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return new SnapshotLoad.Unreadable(path, "snapshot root must be a JSON object");
        }

        JsonNode rawState = root.get(SnapshotCodec.STATE);
        String stateValue = rawState == null || rawState.isNull() ? null : rawState.asText();
        Optional<WorkflowState> state = WorkflowState.fromWireValue(stateValue);
        if (state.isEmpty()) {
            log.warn("Unrecognized state '{}' in workflow snapshot {}", stateValue, path);
            return new SnapshotLoad.UnrecognizedState(path, stateValue);
        }

        try {
            return new SnapshotLoad.Loaded(path, SnapshotCodec.decode(root, state.get()));
        } catch (IllegalArgumentException e) {
            log.warn("Malformed workflow snapshot {}: {}", path, e.getMessage());
            return new SnapshotLoad.Unreadable(path, describe(e));
        }
    }

    @Override
    public PersistenceResult delete(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        try {
            Files.deleteIfExists(path);
            return new PersistenceResult.Persisted(path);
        } catch (IOException e) {
            log.warn("Failed to delete workflow snapshot {}: {}", path, e.getMessage());
            return new PersistenceResult.Degraded(path, describe(e));
        }
    }

    /**
     * Atomic write: .tmp 파일에 기록 후 rename.
     */
    private void writeJsonAtomic(Path target, JsonNode node) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        try {
            Files.writeString(tmpFile, json, StandardCharsets.UTF_8);
            try {
                Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            // .tmp 파일은 orphan sweep 대상이 아니므로 여기서 지움
            try {
                Files.deleteIfExists(tmpFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
