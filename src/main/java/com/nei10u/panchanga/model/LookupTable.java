package com.nei10u.panchanga.model;

import java.util.List;
import java.util.Objects;

/**
 * 定长、不可变的查表结构。
 *
 * 所有下标访问都会按表长做范围校验，避免依赖枚举 ordinal 与数据的隐式耦合。
 * 历法单位的编号一律从 1 开始（{@link #byNumber(int)}），{@link #byIndex(int)} 供从 0 开始的余数直接使用。
 */
public final class LookupTable<T> {

    private final String name;
    private final List<T> entries;

    private LookupTable(String name, List<T> entries) {
        this.name = name;
        this.entries = entries;
    }

    @SafeVarargs
    public static <T> LookupTable<T> of(String name, T... entries) {
        Objects.requireNonNull(name, "name");
        if (entries == null || entries.length == 0) {
            throw new IllegalArgumentException("lookup table '" + name + "' must not be empty");
        }
        return new LookupTable<>(name, List.of(entries));
    }

    public T byNumber(int number) {
        if (number < 1 || number > entries.size()) {
            throw new IllegalArgumentException(
                    name + " number out of range [1, " + entries.size() + "]: " + number);
        }
        return entries.get(number - 1);
    }

    public T byIndex(int index) {
        if (index < 0 || index >= entries.size()) {
            throw new IllegalArgumentException(
                    name + " index out of range [0, " + (entries.size() - 1) + "]: " + index);
        }
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public List<T> entries() {
        return entries;
    }

    public String getName() {
        return name;
    }
}
