package com.cloudsync.server.util;

import com.cloudsync.server.exception.FileOperationException;
import com.cloudsync.server.exception.JsonException;
import com.cloudsync.server.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule()) // jackson to handle field to Instant
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            // rclone 的 json log 字段随版本增加, 未知字段忽略
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static <T> T parseJsonLine(String line, Class<T> clazz) throws ValidationException, JsonException {
        if (ObjectUtils.isEmpty(clazz)) {
            throw new ValidationException("parseJsonLine failed. clazz is null.");
        }
        if (StringUtils.isBlank(line)) {
            return null;
        }
        try {
            return objectMapper.readValue(line.trim(), clazz);
        } catch (JsonProcessingException e) {
            throw new JsonException("parseJsonLine failed. line is %s".formatted(line), e);
        }
    }

    public static <T> T parseJsonDocument(
            String commandLineOutput,
            Class<T> clazz) throws ValidationException, JsonException {
        if (StringUtils.isBlank(commandLineOutput)) {
            throw new ValidationException("parseJsonDocument failed. commandLineOutput is null.");
        }
        try {
            return objectMapper.readValue(commandLineOutput, clazz);
        } catch (JsonProcessingException e) {
            throw new JsonException("parseJsonDocument failed. " +
                    "commandLineOutput is %s".formatted(commandLineOutput),
                    e);
        }
    }

    public static <T> T parseJsonDocument(
            String commandLineOutput,
            TypeReference<T> typeRef) throws ValidationException, JsonException {
        if (StringUtils.isBlank(commandLineOutput)) {
            throw new ValidationException("parseJsonDocument failed. commandLineOutput is null.");
        }
        try {
            return objectMapper.readValue(commandLineOutput, typeRef);
        } catch (JsonProcessingException e) {
            throw new JsonException("parseJsonDocument failed. " +
                    "commandLineOutput is %s".formatted(commandLineOutput),
                    e);
        }
    }

    // 文件不存在返回 null
    public static <T> T readJsonFile(Path file, TypeReference<T> typeRef)
            throws JsonException, FileOperationException {
        if (ObjectUtils.anyNull(file, typeRef)) {
            throw new ValidationException("readJsonFile failed. file or typeRef is null");
        }
        if (!Files.exists(file)) {
            return null;
        }
        String content;
        try {
            content = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileOperationException("readJsonFile failed. file is %s".formatted(file), e);
        }
        if (StringUtils.isBlank(content)) {
            return null;
        }
        try {
            return objectMapper.readValue(content, typeRef);
        } catch (JsonProcessingException e) {
            throw new JsonException("readJsonFile failed. file is %s".formatted(file), e);
        }
    }

    // 全量覆盖写入, 先写临时文件再替换
    public static void writeJsonFile(Path file, Object value) throws JsonException, FileOperationException {
        if (ObjectUtils.isEmpty(file)) {
            throw new ValidationException("writeJsonFile failed. file is null");
        }
        String content;
        try {
            content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonException("writeJsonFile failed. value can't serialize. file is %s".formatted(file), e);
        }
        File target = file.toFile();
        File temp = new File(target.getParentFile(), target.getName() + ".tmp");
        try {
            FileUtils.writeStringToFile(temp, content, StandardCharsets.UTF_8);
            Files.move(temp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            FileUtils.deleteQuietly(temp);
            throw new FileOperationException("writeJsonFile failed. file is %s".formatted(file), e);
        }
    }
}
