package com.zonesearch.document;

import com.zonesearch.config.Constants;

import java.util.ArrayList;
import java.util.List;

/**
 * 语料中的一篇文档：第 0 个区域为 docID 区域，其后为内容区域。
 */
public record Document(List<Zone> zones) {

    public Document {
        if (zones == null) {
            throw new IllegalArgumentException("zones不能为null");
        }
        zones = List.copyOf(zones);
    }

    /**
     * 按语料中的字段顺序构建文档，docID 区域被移动到最前，其余区域保持原有顺序。
     * 缺少 docID 区域时保持原样，交由索引构建器报告。
     */
    public static Document ofFields(List<Zone> fields) {
        List<Zone> ordered = new ArrayList<>(fields.size());
        Zone docIdZone = null;
        for (Zone field : fields) {
            if (docIdZone == null && Constants.DOC_ID_ZONE.equals(field.name())) {
                docIdZone = field;
            } else {
                ordered.add(field);
            }
        }
        if (docIdZone != null) {
            ordered.add(0, docIdZone);
        }
        return new Document(ordered);
    }

    public Zone docIdZone() {
        return zones.isEmpty() ? null : zones.get(0);
    }

    public List<Zone> contentZones() {
        return zones.size() <= 1 ? List.of() : zones.subList(1, zones.size());
    }

    public int zoneCount() {
        return zones.size();
    }
}
