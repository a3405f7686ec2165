package com.libragraph.job.api;

import java.util.List;

public record TaskTypeInfo(String path, List<String> requiredParams) {}
