package bio.terra.pouch.services;

import bio.terra.pouch.exception.ConfigurationException;
import bio.terra.pouch.exception.TemplateRenderException;
import bio.terra.pouch.models.FileSpec;
import java.io.IOException;
import java.nio.file.Files;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.common.TemplateParserContext;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

/**
 * Renders file templates. Templates are text with embedded {@code #{...}} expressions; the only
 * function available to them is {@code secret('name', 'key')}.
 */
@Component
public class TemplateRenderer {

  private static final ExpressionParser PARSER = new SpelExpressionParser();
  private static final TemplateParserContext TEMPLATE_CONTEXT = new TemplateParserContext();

  public String render(FileSpec fileSpec, SecretLookup secretLookup) {
    var template = fileSpec.getTemplate();
    var templateFile = fileSpec.getTemplateFile();
    if (template.isPresent() && templateFile.isPresent()) {
      throw new ConfigurationException(
          "inline template and template file specified for " + fileSpec.getPath());
    }
    if (template.isPresent()) {
      return evaluate("inline-template", template.get(), new FileFunctions(secretLookup));
    }
    if (templateFile.isPresent()) {
      String text;
      try {
        text = Files.readString(templateFile.get());
      } catch (IOException e) {
        throw new ConfigurationException("Couldn't read template file " + templateFile.get(), e);
      }
      return evaluate(templateFile.get().toString(), text, new FileFunctions(secretLookup));
    }
    throw new ConfigurationException("no content defined for file " + fileSpec.getPath());
  }

  /** Evaluate a template with the public methods of {@code functions} callable from it. */
  static String evaluate(String templateName, String text, Object functions) {
    var context =
        SimpleEvaluationContext.forReadOnlyDataBinding()
            .withInstanceMethods()
            .withRootObject(functions)
            .build();
    try {
      var value = PARSER.parseExpression(text, TEMPLATE_CONTEXT).getValue(context, String.class);
      return value == null ? "" : value;
    } catch (ParseException | EvaluationException e) {
      throw new TemplateRenderException(
          "Failed to render template %s: %s".formatted(templateName, e.getMessage()), e);
    }
  }

  public static class FileFunctions {
    private final SecretLookup secretLookup;

    FileFunctions(SecretLookup secretLookup) {
      this.secretLookup = secretLookup;
    }

    public String secret(String name, String key) {
      var value = secretLookup.lookup(name, key);
      return value == null ? "" : value.toString();
    }
  }
}
