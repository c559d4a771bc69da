package com.eyelevel.contentmoderation.dto.report.response;

public record CategoryCount(String name, long count) {
}
