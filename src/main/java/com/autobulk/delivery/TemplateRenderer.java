package com.autobulk.delivery;

import com.autobulk.error.RenderException;

public interface TemplateRenderer {

    RenderedMessage render(String templateId, DispatchContext context) throws RenderException;
}
