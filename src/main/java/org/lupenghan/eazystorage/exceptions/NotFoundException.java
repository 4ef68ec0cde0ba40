package org.lupenghan.eazystorage.exceptions;

/**
 * 查找失败：字段、索引、表或标识符不存在
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
