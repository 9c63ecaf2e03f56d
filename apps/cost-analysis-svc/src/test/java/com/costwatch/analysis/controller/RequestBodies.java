package com.costwatch.analysis.controller;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.costwatch.analysis.CostRecordFixtures.START;

final class RequestBodies {

    private RequestBodies() {
    }

    static List<Map<String, Object>> records(String service, double... values) {
        List<Map<String, Object>> records = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("date", START.plusDays(i).toString());
            record.put("service", service);
            record.put("amount", values[i]);
            records.add(record);
        }
        return records;
    }
}
