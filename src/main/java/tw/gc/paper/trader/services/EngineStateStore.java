package tw.gc.paper.trader.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.paper.trader.config.TradingProperties;
import tw.gc.paper.trader.entities.EngineState;
import tw.gc.paper.trader.exceptions.StatePersistenceException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON file store for {@link EngineState}. Writes go to a temp file that is then moved over
 * the target, so a crash mid-write leaves the previous state intact.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EngineStateStore {

    public static final int SCHEMA_VERSION = 1;

    private final ObjectMapper objectMapper;
    private final TradingProperties tradingProperties;

    public boolean isEnabled() {
        return tradingProperties.getPersistence().isEnabled();
    }

    public Path getPath() {
        return Path.of(tradingProperties.getPersistence().getStateFile());
    }

    /**
     * @return empty if persistence is disabled or no state was saved yet
     * @throws StatePersistenceException if a state file exists but cannot be read
     */
    public Optional<EngineState> load() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        Path path = getPath();
        if (!Files.exists(path)) {
            log.info("💾 No saved engine state at {}, starting fresh", path);
            return Optional.empty();
        }
        try {
            EngineState state = objectMapper.readValue(path.toFile(), EngineState.class);
            if (state.getSchemaVersion() != SCHEMA_VERSION) {
                throw new StatePersistenceException("Unsupported state schema " + state.getSchemaVersion()
                        + " in " + path, null);
            }
            log.info("💾 Loaded engine state from {} ({} trades, active {})", path,
                    state.getTrades() == null ? 0 : state.getTrades().size(),
                    state.getActiveStrategy() == null ? "none" : state.getActiveStrategy().getId());
            return Optional.of(state);
        } catch (IOException e) {
            throw new StatePersistenceException("Cannot read engine state from " + path, e);
        }
    }

    public void save(EngineState state) {
        if (!isEnabled()) {
            return;
        }
        Path path = getPath().toAbsolutePath();
        try {
            Path dir = path.getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
                try {
                    Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new StatePersistenceException("Cannot write engine state to " + path, e);
        }
    }
}
