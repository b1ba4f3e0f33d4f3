package com.bit.restake.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 20字节账户地址（EVM风格），统一用户/合约/资产的标识
 * 文本形式为 0x + 40位小写十六进制
 */
@EqualsAndHashCode(of = "value")
public final class Address implements Serializable, Comparable<Address> {
    public static final int LENGTH = 20;
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

    /** 零地址，任何入口都视为非法输入 */
    public static final Address ZERO = new Address(new byte[LENGTH]);

    /** 原生币占位地址（0xeeee...eeee） */
    public static final Address NATIVE = fromHex("0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee");

    private final byte[] value;
    // 缓存十六进制字符串
    private final String hexValue;

    private Address(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Address value cannot be null");
        }
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为" + LENGTH + "字节, got " + value.length);
        }
        this.value = Arrays.copyOf(value, LENGTH);
        this.hexValue = toHexInternal(this.value);
    }

    @JsonCreator
    public static Address fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Address hex cannot be null");
        }
        String body = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (body.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Invalid hex string length for 20-byte address: " + hex);
        }
        byte[] bytes = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            int high = Character.digit(body.charAt(i * 2), 16);
            int low = Character.digit(body.charAt(i * 2 + 1), 16);
            if (high == -1 || low == -1) {
                throw new IllegalArgumentException("Invalid hex character in: " + hex);
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return new Address(bytes);
    }

    /**
     * 由序号生成确定性地址，末尾8字节为大端序号，测试和默认配置使用
     */
    public static Address ofIndex(long index) {
        byte[] bytes = new byte[LENGTH];
        for (int i = 0; i < 8; i++) {
            bytes[LENGTH - 1 - i] = (byte) (index >>> (8 * i));
        }
        return new Address(bytes);
    }

    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    public boolean isNative() {
        return this.equals(NATIVE);
    }

    @JsonValue
    public String toHex() {
        return hexValue;
    }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return hexValue;
    }

    private static String toHexInternal(byte[] bytes) {
        StringBuilder sb = new StringBuilder(2 + LENGTH * 2);
        sb.append("0x");
        for (byte b : bytes) {
            sb.append(HEX_CHARS[(b >>> 4) & 0x0F]);
            sb.append(HEX_CHARS[b & 0x0F]);
        }
        return sb.toString();
    }
}
