package com.flamingo.ai.tenderlens.service.prompt;

import java.math.BigDecimal;

/** One purchase line of the tender. */
public record TenderItem(String name, int quantity, BigDecimal price, BigDecimal total) {}
