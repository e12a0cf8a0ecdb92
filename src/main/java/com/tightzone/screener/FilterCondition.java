package com.tightzone.screener;

import com.tightzone.core.ScreenerException;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 模块说明：FilterCondition（class）。
 * 主要职责：描述一条扫描过滤条件 left/operation/right，构造后不可变。
 * 使用建议：right 为 null 表示该运算符不需要右值（例如 nempty）。
 */
public final class FilterCondition {
    public final String field;
    public final FilterOperation operation;
    public final Object value;

    private FilterCondition(String field, FilterOperation operation, Object value) {
        this.field = field;
        this.operation = operation;
        this.value = value;
    }

    public static FilterCondition of(String field, FilterOperation operation) {
        return of(field, operation, null);
    }

    public static FilterCondition of(String field, FilterOperation operation, Object value) {
        if (field == null || field.trim().isEmpty()) {
            throw ScreenerException.invalidInput("filter field must not be empty");
        }
        if (operation == null) {
            throw ScreenerException.invalidInput("filter operation must not be null for field " + field);
        }
        if (operation.needsValue() && value == null) {
            throw ScreenerException.invalidInput("filter operation " + operation.wireName() + " needs a value for field " + field);
        }
        Object normalized = value instanceof List<?> list ? Collections.unmodifiableList(new ArrayList<>(list)) : value;
        return new FilterCondition(field.trim(), operation, normalized);
    }

/**
 * 方法说明：fromJson，负责把自定义过滤定义解析为条件对象。
 * 处理流程：非 JSON 对象、缺少 left 或未知 operation 均视为 INVALID_INPUT。
 */
    public static FilterCondition fromJson(Object raw) {
        if (!(raw instanceof JSONObject)) {
            throw ScreenerException.invalidInput("filter definition must be a JSON object: " + raw);
        }
        JSONObject obj = (JSONObject) raw;
        String left = obj.optString("left", "");
        String opName = obj.optString("operation", "");
        FilterOperation op = FilterOperation.fromWireName(opName);
        if (op == null) {
            throw ScreenerException.invalidInput("unknown filter operation '" + opName + "' for field " + left);
        }
        Object right = obj.has("right") && !obj.isNull("right") ? obj.get("right") : null;
        if (right instanceof JSONArray arr) {
            right = arr.toList();
        } else if (right instanceof JSONObject) {
            throw ScreenerException.invalidInput("filter value must be a scalar or list for field " + left);
        }
        return of(left, op, right);
    }

    public static List<FilterCondition> listFromJson(String json) {
        JSONArray arr;
        try {
            arr = new JSONArray(json);
        } catch (Exception e) {
            throw ScreenerException.invalidInput("filters must be a JSON array: " + e.getMessage());
        }
        List<FilterCondition> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            out.add(fromJson(arr.get(i)));
        }
        return out;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("left", field);
        obj.put("operation", operation.wireName());
        if (value != null) {
            obj.put("right", value);
        }
        return obj;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterCondition)) return false;
        FilterCondition other = (FilterCondition) o;
        return field.equals(other.field) && operation == other.operation && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operation, value);
    }

    @Override
    public String toString() {
        return field + " " + operation.wireName() + (value == null ? "" : " " + value);
    }
}
