package io.b2mash.siteledger.progress;

import java.util.List;

public record StatementDetail(ProgressStatement statement, List<ProgressStatementLine> lines) {}
