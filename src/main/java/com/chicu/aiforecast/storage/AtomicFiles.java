package com.chicu.aiforecast.storage;

import com.chicu.aiforecast.common.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Запись temp → fsync → rename в том же каталоге. Читатель видит либо старый файл, либо новый целиком.
 */
@Slf4j
public final class AtomicFiles {

    private AtomicFiles() {
    }

    public static void write(Path target, byte[] data) {
        replace(writeTemp(target, data), target);
    }

    /**
     * Первая половина write(): temp-файл рядом с target, данные уже на диске. Target не тронут.
     */
    public static Path writeTemp(Path target, byte[] data) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");

            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(data);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            return tmp;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("write failed: " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * Вторая половина write(): rename temp → target. При ошибке temp удаляется.
     */
    public static void replace(Path tmp, Path target) {
        try {
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("ATOMIC_MOVE не поддерживается для {}, обычный replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("write failed: " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * Удаление уже ненужного файла: ошибка логируется, прогон не валит.
     */
    public static boolean deleteQuietly(Path p) {
        if (p == null) return false;
        try {
            return Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("⚠️ не удалось удалить {}: {}", p, e.getMessage());
            return false;
        }
    }
}
