package se.alipsa.halsls.lsp;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolKind;
import se.alipsa.halsls.core.model.SymbolInfo;

/** Mapping between the core model and the lsp4j protocol types. */
final class LspConverters {
  private LspConverters() {}

  static se.alipsa.halsls.core.model.Position toCore(Position p) {
    return new se.alipsa.halsls.core.model.Position(p.getLine(), p.getCharacter());
  }

  static Position toLsp(se.alipsa.halsls.core.model.Position p) {
    return new Position(p.line, p.column);
  }

  static Range toLsp(se.alipsa.halsls.core.model.Range r) {
    return new Range(toLsp(r.start), toLsp(r.end));
  }

  static Location toLsp(se.alipsa.halsls.core.model.Location l) {
    return new Location(l.getUri(), toLsp(l.getRange()));
  }

  static Diagnostic toLsp(se.alipsa.halsls.core.model.Diagnostic d) {
    return new Diagnostic(toLsp(d.getRange()), d.getMessage(), severity(d.getSeverity()), d.getSource(), d.getCode());
  }

  static Hover toLsp(se.alipsa.halsls.core.model.Hover h) {
    return new Hover(new MarkupContent(MarkupKind.MARKDOWN, h.getContents()));
  }

  static CompletionItem toLsp(se.alipsa.halsls.core.model.CompletionItem c) {
    CompletionItem item = new CompletionItem(c.getLabel());
    item.setKind(completionKind(c.getKind()));
    item.setDetail(c.getDetail());
    if (c.getDocumentation() != null) item.setDocumentation(c.getDocumentation());
    return item;
  }

  static DocumentSymbol toLsp(SymbolInfo s) {
    return new DocumentSymbol(s.getName(), symbolKind(s.getKind()),
        toLsp(s.getLocation().getRange()), toLsp(s.getSelectionRange()), s.getDetail());
  }

  static DiagnosticSeverity severity(se.alipsa.halsls.core.model.Diagnostic.Severity severity) {
    return switch (severity) {
      case ERROR -> DiagnosticSeverity.Error;
      case WARNING -> DiagnosticSeverity.Warning;
      case INFORMATION -> DiagnosticSeverity.Information;
      case HINT -> DiagnosticSeverity.Hint;
    };
  }

  static CompletionItemKind completionKind(se.alipsa.halsls.core.model.CompletionItem.Kind kind) {
    return switch (kind) {
      case KEYWORD -> CompletionItemKind.Keyword;
      case MODULE -> CompletionItemKind.Module;
      case FUNCTION -> CompletionItemKind.Function;
      case VARIABLE -> CompletionItemKind.Variable;
      case CONSTANT -> CompletionItemKind.Constant;
      case STRUCT -> CompletionItemKind.Struct;
      case REFERENCE -> CompletionItemKind.Reference;
      case SNIPPET -> CompletionItemKind.Snippet;
    };
  }

  static SymbolKind symbolKind(SymbolInfo.Kind kind) {
    return switch (kind) {
      case MODULE -> SymbolKind.Module;
      case FUNCTION -> SymbolKind.Function;
      case VARIABLE -> SymbolKind.Variable;
      case CONSTANT -> SymbolKind.Constant;
      case STRUCT -> SymbolKind.Struct;
      case KEY -> SymbolKind.Key;
      case STRING -> SymbolKind.String;
    };
  }
}
