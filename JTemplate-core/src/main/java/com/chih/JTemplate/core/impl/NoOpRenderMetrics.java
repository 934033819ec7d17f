package com.chih.JTemplate.core.impl;

import com.chih.JTemplate.core.spi.RenderMetrics;

public class NoOpRenderMetrics implements RenderMetrics {
    @Override
    public void recordRender(String templateId, long durationNs, boolean success) {
        // Do nothing
    }
}
