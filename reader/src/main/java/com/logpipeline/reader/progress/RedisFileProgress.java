package com.logpipeline.reader.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logpipeline.reader.config.ReaderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Cursors stored as JSON in a Redis hash, one field per file name, so a restarted
 * reader resumes where the previous one stopped.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pipeline.reader.progress-store", havingValue = "redis", matchIfMissing = true)
public class RedisFileProgress implements FileProgress {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String key;

    public RedisFileProgress(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, ReaderProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.key = properties.getProgressKey();
    }

    @Override
    public FileCursor cursor(String fileName) {
        String value = hash().get(key, fileName);
        if (value == null) {
            return FileCursor.START;
        }
        try {
            return objectMapper.readValue(value, FileCursor.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cursor for {} in {}, streaming the file from the start: {}",
                fileName, key, e.getOriginalMessage());
            return FileCursor.START;
        }
    }

    @Override
    public void retainOnly(Set<String> fileNames) {
        Set<String> stored = hash().keys(key);
        if (stored == null) {
            return;
        }
        Object[] stale = stored.stream().filter(name -> !fileNames.contains(name)).toArray();
        if (stale.length > 0) {
            hash().delete(key, stale);
            log.info("Dropped cursors of {} file(s) no longer in the log directory", stale.length);
        }
    }

    @Override
    public void save(String fileName, FileCursor cursor) {
        try {
            hash().put(key, fileName, objectMapper.writeValueAsString(cursor));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cursor for " + fileName, e);
        }
    }

    private HashOperations<String, String, String> hash() {
        return redisTemplate.opsForHash();
    }
}
