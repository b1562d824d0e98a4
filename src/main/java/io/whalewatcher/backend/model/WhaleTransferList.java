package io.whalewatcher.backend.model;

import java.util.List;

public record WhaleTransferList(List<TransferRecord> transfers, int count, String summary) {}
