package app.qbank.core.bank;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Flat JSON snapshot of a whole {@link QuestionBank}. Field names are snake_case and instants are
 * ISO-8601, so scheduling state and ratings survive a save/load unchanged. The active session is
 * not written.
 */
@Component
public class QuestionBankStore {
    private static final Logger log = LoggerFactory.getLogger(QuestionBankStore.class);

    private final ObjectMapper mapper;

    public QuestionBankStore(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void save(QuestionBank bank, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                write(bank, out);
            }
            log.info("Saved bank '{}' ({} questions, {} sessions) to {}",
                    bank.getName(), bank.size(), bank.getSessions().size(), path);
        } catch (IOException ex) {
            log.warn("Failed to save bank to {}: {}", path, ex.getMessage());
            throw new UncheckedIOException("Failed to save bank to " + path, ex);
        }
    }

    public QuestionBank load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            QuestionBank bank = read(in);
            log.info("Loaded bank '{}' ({} questions) from {}", bank.getName(), bank.size(), path);
            return bank;
        } catch (IOException ex) {
            log.warn("Failed to load bank from {}: {}", path, ex.getMessage());
            throw new UncheckedIOException("Failed to load bank from " + path, ex);
        }
    }

    public void write(QuestionBank bank, OutputStream out) throws IOException {
        mapper.writeValue(out, bank);
    }

    public QuestionBank read(InputStream in) throws IOException {
        return mapper.readValue(in, QuestionBank.class);
    }
}
