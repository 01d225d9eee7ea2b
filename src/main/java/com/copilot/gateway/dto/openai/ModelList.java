package com.copilot.gateway.dto.openai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Copilot /models 返回的模型列表
 * <p>
 * 每个条目保留上游的全部字段，只替换 id
 */
public record ModelList(List<ModelEntry> data) {

    public record ModelEntry(String id, JSONObject raw) {

        public ModelEntry withId(String newId) {
            JSONObject copy = new JSONObject(raw);
            copy.put("id", newId);
            return new ModelEntry(newId, copy);
        }
    }

    public static ModelList parse(JSONObject json) {
        JSONArray array = json.getJSONArray("data");
        if (array == null) {
            throw new IllegalArgumentException("missing data");
        }
        List<ModelEntry> entries = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JSONObject entry = array.getJSONObject(i);
            String id = entry.getString("id");
            if (id != null) {
                entries.add(new ModelEntry(id, entry));
            }
        }
        return new ModelList(entries);
    }

    public JSONObject toJson() {
        JSONArray array = new JSONArray(data.size());
        for (ModelEntry entry : data) {
            array.add(entry.raw());
        }
        return JSONObject.of("object", "list", "data", array);
    }
}
