package com.findinpath.hierarchy.jdbc;

import java.util.Calendar;
import java.util.TimeZone;

final class Constants {
    static final Calendar TZ_UTC = Calendar.getInstance(TimeZone.getTimeZone("UTC"));

    private Constants() {
    }
}
