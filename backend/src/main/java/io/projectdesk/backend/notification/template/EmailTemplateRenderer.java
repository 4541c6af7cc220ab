package io.projectdesk.backend.notification.template;

import io.projectdesk.backend.integration.email.RenderedEmail;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders HTML emails from Thymeleaf classpath templates under {@code templates/email/}.
 *
 * <p>Rendering uses two passes: the content template is rendered first, then the result is injected
 * into the {@code base} layout as unescaped HTML.
 */
@Service
public class EmailTemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateRenderer.class);
  private static final String DEFAULT_SUBJECT = "ProjectDesk";

  private final TemplateEngine emailTemplateEngine;

  public EmailTemplateRenderer() {
    this.emailTemplateEngine = createEmailTemplateEngine();
  }

  /**
   * @param templateName template name without path or suffix (e.g., "email-verification")
   * @param context template variables; {@code subject} becomes the email subject
   */
  public RenderedEmail render(String templateName, Map<String, Object> context) {
    var ctx = new Context();
    context.forEach(ctx::setVariable);

    String contentHtml = emailTemplateEngine.process(templateName, ctx);

    ctx.setVariable("contentHtml", contentHtml);
    String fullHtml = emailTemplateEngine.process("base", ctx);

    Object subject = context.get("subject");
    log.debug("Rendered email template '{}', HTML size={}", templateName, fullHtml.length());
    return new RenderedEmail(
        subject != null ? subject.toString() : DEFAULT_SUBJECT, fullHtml, toPlainText(fullHtml));
  }

  /** Strips tags for the plain-text alternative, keeping link targets in parentheses. */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    String text = html;
    text = text.replaceAll("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", "$2 ($1)");
    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</p>", "\n\n");
    text = text.replaceAll("</div>", "\n");
    text = text.replaceAll("<[^>]+>", "");
    text = text.replace("&amp;", "&");
    text = text.replace("&lt;", "<");
    text = text.replace("&gt;", ">");
    text = text.replace("&quot;", "\"");
    text = text.replace("&nbsp;", " ");
    text = text.replace("&#39;", "'");
    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("\\n[ \\t]+", "\n");
    text = text.replaceAll("\\n{3,}", "\n\n");
    return text.strip();
  }

  private static TemplateEngine createEmailTemplateEngine() {
    var engine = new TemplateEngine();

    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    engine.setTemplateResolver(resolver);
    return engine;
  }
}
