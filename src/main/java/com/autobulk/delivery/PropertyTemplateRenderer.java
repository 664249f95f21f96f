package com.autobulk.delivery;

import com.autobulk.config.AutobulkProperties;
import com.autobulk.error.RenderException;
import org.springframework.util.PropertyPlaceholderHelper;

import java.util.Map;
import java.util.Properties;

/**
 * Renders templates declared under {@code autobulk.templates.<id>}. Subject and body may use the
 * {@code ${jobId}}, {@code ${executionId}}, {@code ${attempt}} and {@code ${templateId}}
 * placeholders; any other placeholder is left as written.
 */
public class PropertyTemplateRenderer implements TemplateRenderer {

    private static final PropertyPlaceholderHelper PLACEHOLDERS = new PropertyPlaceholderHelper("${", "}", null, true);

    private final Map<String, AutobulkProperties.Template> templates;

    public PropertyTemplateRenderer(Map<String, AutobulkProperties.Template> templates) {
        this.templates = templates;
    }

    @Override
    public RenderedMessage render(String templateId, DispatchContext context) throws RenderException {
        AutobulkProperties.Template template = templateId == null ? null : templates.get(templateId);
        if (template == null) {
            throw new RenderException("Unknown template '" + templateId + "'");
        }

        Properties values = new Properties();
        values.setProperty("templateId", templateId);
        values.setProperty("jobId", String.valueOf(context.jobId()));
        values.setProperty("executionId", String.valueOf(context.executionId()));
        values.setProperty("attempt", String.valueOf(context.attemptNumber()));
        try {
            return new RenderedMessage(
                    templateId,
                    PLACEHOLDERS.replacePlaceholders(nullToEmpty(template.getSubject()), values),
                    PLACEHOLDERS.replacePlaceholders(nullToEmpty(template.getBody()), values));
        } catch (IllegalArgumentException e) {
            throw new RenderException("Template '" + templateId + "' could not be rendered: " + e.getMessage(), e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
