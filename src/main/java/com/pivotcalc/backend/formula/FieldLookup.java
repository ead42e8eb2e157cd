package com.pivotcalc.backend.formula;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.pivotcalc.backend.field.ValueField;

/**
 * 字段名 -> 值字段下标，忽略大小写。
 * 每个字段先登记 key 再登记 header，同名时先登记者优先；空白名称不登记。
 */
public class FieldLookup {
    private final Map<String, Integer> names = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final int fieldCount;

    private FieldLookup(int fieldCount) {
        this.fieldCount = fieldCount;
    }

    public static FieldLookup of(List<ValueField> fields) {
        FieldLookup lookup = new FieldLookup(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            ValueField field = fields.get(i);
            if(field == null) {
                continue;
            }
            lookup.register(field.getKey(), i);
            lookup.register(field.getHeader(), i);
        }
        return lookup;
    }

    private void register(String name, int index) {
        if(name == null || name.isBlank()) {
            return;
        }
        names.putIfAbsent(name.trim(), index);
    }

    /**
     * @return 字段下标，找不到时返回 -1
     */
    public int indexOf(String name) {
        if(name == null) {
            return -1;
        }
        Integer index = names.get(name.trim());
        return index == null ? -1 : index;
    }

    public int getFieldCount() {
        return fieldCount;
    }
}
