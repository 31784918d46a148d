package com.nei10u.panchanga.model;

import lombok.Data;

@Data
public class PanchangaRequest {
    private String requestId;
    private int year;
    private int month;
    private int day;
    private int hour;
    private int minute;
    private int second;
    private Double latitude;   // 纬度，北正南负
    private Double longitude;  // 经度，东正西负
    private String timezone;   // IANA 时区或小时偏移（如 "5.5"），可选
}
