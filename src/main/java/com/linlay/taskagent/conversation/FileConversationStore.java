package com.linlay.taskagent.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JSON Lines backed conversation store.
 * <p>
 * {@code _conversations.jsonl} holds one index line per conversation and is rewritten whenever a
 * conversation changes; {@code <conversationId>.jsonl} holds the message log and is only ever
 * appended to. Writes are serialized by a single store lock so sequence numbers and timestamps
 * are assigned in append order.
 */
@Service
public class FileConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(FileConversationStore.class);
    private static final String CONVERSATION_INDEX_FILE = "_conversations.jsonl";
    private static final int TITLE_MAX_CODE_POINTS = 30;

    private final ObjectMapper objectMapper;
    private final ConversationStoreProperties properties;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, LogTail> tailsByConversationId = new HashMap<>();

    @Autowired
    public FileConversationStore(ObjectMapper objectMapper, ConversationStoreProperties properties) {
        this(objectMapper, properties, Clock.systemUTC());
    }

    FileConversationStore(ObjectMapper objectMapper, ConversationStoreProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Conversation getOrCreate(String userId, String conversationId) {
        requireUser(userId);
        if (!StringUtils.hasText(conversationId)) {
            return create(userId);
        }
        synchronized (lock) {
            ConversationIndexRecord record = readIndexRecords().get(conversationId.trim());
            if (record == null || !userId.equals(record.userId)) {
                throw new ConversationNotFoundException(conversationId);
            }
            return toConversation(record);
        }
    }

    @Override
    public Conversation find(String userId, String conversationId) {
        requireUser(userId);
        synchronized (lock) {
            return toConversation(requireOwned(readIndexRecords(), userId, conversationId));
        }
    }

    @Override
    public ConversationMessage appendMessage(String userId, String conversationId, MessageRole role, String content) {
        requireUser(userId);
        if (role == null) {
            throw new IllegalArgumentException("message role is required");
        }
        synchronized (lock) {
            LinkedHashMap<String, ConversationIndexRecord> records = readIndexRecords();
            ConversationIndexRecord record = requireOwned(records, userId, conversationId);

            LogTail tail = tailsByConversationId.computeIfAbsent(record.conversationId, this::loadTail);
            long seq = tail.seq + 1;
            long createdAt = Math.max(clock.millis(), tail.createdAt);

            StoredMessageLine line = new StoredMessageLine();
            line.id = UUID.randomUUID().toString();
            line.conversationId = record.conversationId;
            line.userId = userId;
            line.seq = seq;
            line.role = role.value();
            line.content = content == null ? "" : content;
            line.createdAt = createdAt;
            appendLine(record.conversationId, line);
            tailsByConversationId.put(record.conversationId, new LogTail(seq, createdAt));

            record.updatedAt = Math.max(record.updatedAt, createdAt);
            if (role == MessageRole.USER && !StringUtils.hasText(record.title)) {
                record.title = deriveTitle(line.content);
            }
            writeIndexRecords(records.values());
            return toMessage(line);
        }
    }

    @Override
    public List<ConversationMessage> history(String userId, String conversationId) {
        requireUser(userId);
        synchronized (lock) {
            ConversationIndexRecord record = requireOwned(readIndexRecords(), userId, conversationId);
            List<ConversationMessage> messages = new ArrayList<>();
            for (StoredMessageLine line : readMessageLines(record.conversationId)) {
                messages.add(toMessage(line));
            }
            messages.sort(Comparator.comparingLong(ConversationMessage::seq));
            return List.copyOf(messages);
        }
    }

    @Override
    public List<Conversation> listConversations(String userId) {
        requireUser(userId);
        synchronized (lock) {
            return readIndexRecords().values().stream()
                    .filter(record -> userId.equals(record.userId))
                    .sorted(Comparator.comparingLong((ConversationIndexRecord record) -> record.updatedAt)
                            .thenComparingLong(record -> record.createdAt)
                            .reversed())
                    .map(this::toConversation)
                    .toList();
        }
    }

    private Conversation create(String userId) {
        synchronized (lock) {
            LinkedHashMap<String, ConversationIndexRecord> records = readIndexRecords();
            long now = clock.millis();
            ConversationIndexRecord record = new ConversationIndexRecord();
            record.conversationId = UUID.randomUUID().toString();
            record.userId = userId;
            record.createdAt = now;
            record.updatedAt = now;
            records.put(record.conversationId, record);
            writeIndexRecords(records.values());
            tailsByConversationId.put(record.conversationId, new LogTail(0L, now));
            log.debug("Created conversation id={} for user={}", record.conversationId, userId);
            return toConversation(record);
        }
    }

    private ConversationIndexRecord requireOwned(
            Map<String, ConversationIndexRecord> records,
            String userId,
            String conversationId
    ) {
        if (!StringUtils.hasText(conversationId)) {
            throw new ConversationNotFoundException(String.valueOf(conversationId));
        }
        ConversationIndexRecord record = records.get(conversationId.trim());
        if (record == null) {
            throw new ConversationNotFoundException(conversationId);
        }
        if (!userId.equals(record.userId)) {
            throw new ConversationAccessDeniedException(conversationId);
        }
        return record;
    }

    private LogTail loadTail(String conversationId) {
        long seq = 0L;
        long createdAt = 0L;
        for (StoredMessageLine line : readMessageLines(conversationId)) {
            seq = Math.max(seq, line.seq);
            createdAt = Math.max(createdAt, line.createdAt);
        }
        return new LogTail(seq, createdAt);
    }

    private List<StoredMessageLine> readMessageLines(String conversationId) {
        Path path = resolveMessagesPath(conversationId);
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            List<StoredMessageLine> lines = new ArrayList<>();
            for (String raw : Files.readAllLines(path, resolveCharset())) {
                if (!StringUtils.hasText(raw)) {
                    continue;
                }
                JsonNode node = parseLine(raw);
                if (node == null || !node.isObject()) {
                    log.warn("Skip unreadable message line in conversation={}", conversationId);
                    continue;
                }
                lines.add(objectMapper.treeToValue(node, StoredMessageLine.class));
            }
            return lines;
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read message log for conversationId=" + conversationId, ex);
        }
    }

    private void appendLine(String conversationId, StoredMessageLine line) {
        Path path = resolveMessagesPath(conversationId);
        try {
            Files.createDirectories(path.getParent());
            String jsonLine = objectMapper.writeValueAsString(line) + System.lineSeparator();
            Files.writeString(
                    path,
                    jsonLine,
                    resolveCharset(),
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE
            );
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot append message for conversationId=" + conversationId, ex);
        }
    }

    private LinkedHashMap<String, ConversationIndexRecord> readIndexRecords() {
        LinkedHashMap<String, ConversationIndexRecord> records = new LinkedHashMap<>();
        Path path = resolveIndexPath();
        if (!Files.exists(path)) {
            return records;
        }
        try {
            for (String line : Files.readAllLines(path, resolveCharset())) {
                if (!StringUtils.hasText(line)) {
                    continue;
                }
                JsonNode node = parseLine(line);
                if (node == null || !node.isObject()) {
                    continue;
                }
                ConversationIndexRecord record = objectMapper.treeToValue(node, ConversationIndexRecord.class);
                if (record == null || !StringUtils.hasText(record.conversationId) || !StringUtils.hasText(record.userId)) {
                    continue;
                }
                if (record.updatedAt <= 0) {
                    record.updatedAt = record.createdAt;
                }
                records.put(record.conversationId, record);
            }
            return records;
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read conversation index file=" + path, ex);
        }
    }

    private void writeIndexRecords(Iterable<ConversationIndexRecord> records) {
        Path path = resolveIndexPath();
        try {
            Files.createDirectories(path.getParent());
            StringBuilder content = new StringBuilder();
            for (ConversationIndexRecord record : records) {
                content.append(objectMapper.writeValueAsString(record)).append(System.lineSeparator());
            }
            Files.writeString(
                    path,
                    content.toString(),
                    resolveCharset(),
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE
            );
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot rewrite conversation index file=" + path, ex);
        }
    }

    private JsonNode parseLine(String line) {
        try {
            return objectMapper.readTree(line);
        } catch (Exception ex) {
            return null;
        }
    }

    private Conversation toConversation(ConversationIndexRecord record) {
        return new Conversation(
                record.conversationId,
                record.userId,
                record.title,
                record.createdAt,
                record.updatedAt
        );
    }

    private ConversationMessage toMessage(StoredMessageLine line) {
        return new ConversationMessage(
                line.id,
                line.conversationId,
                line.userId,
                line.seq,
                MessageRole.fromValue(line.role),
                line.content,
                line.createdAt
        );
    }

    private String deriveTitle(String message) {
        String normalized = StringUtils.hasText(message)
                ? message.trim().replaceAll("\\s+", " ")
                : "";
        if (normalized.isEmpty()) {
            return null;
        }
        int[] codePoints = normalized.codePoints().limit(TITLE_MAX_CODE_POINTS).toArray();
        return new String(codePoints, 0, codePoints.length);
    }

    private void requireUser(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId is required");
        }
    }

    private Charset resolveCharset() {
        String configured = properties.getCharset();
        if (!StringUtils.hasText(configured)) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(configured.trim());
        } catch (Exception ignored) {
            return StandardCharsets.UTF_8;
        }
    }

    private Path resolveBaseDir() {
        return Paths.get(properties.getDir()).toAbsolutePath().normalize();
    }

    private Path resolveIndexPath() {
        return resolveBaseDir().resolve(CONVERSATION_INDEX_FILE);
    }

    private Path resolveMessagesPath(String conversationId) {
        return resolveBaseDir().resolve(conversationId + ".jsonl");
    }

    private record LogTail(long seq, long createdAt) {
    }

    private static final class ConversationIndexRecord {
        public String conversationId;
        public String userId;
        public String title;
        public long createdAt;
        public long updatedAt;
    }

    private static final class StoredMessageLine {
        public String id;
        public String conversationId;
        public String userId;
        public long seq;
        public String role;
        public String content;
        public long createdAt;
    }
}
