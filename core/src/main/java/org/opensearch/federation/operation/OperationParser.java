/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.operation;

import com.google.common.base.Strings;
import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.Definition;
import graphql.language.Directive;
import graphql.language.EnumValue;
import graphql.language.FloatValue;
import graphql.language.IntValue;
import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.NullValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.SourceLocation;
import graphql.language.StringValue;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.language.Value;
import graphql.language.VariableReference;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.opensearch.federation.exception.InvalidOperationException;

/**
 * Parser for executable documents and federation field sets ({@code @key}, {@code @requires} and
 * {@code @provides} arguments). Syntax is checked by the graphql-java parser; its AST is then
 * mapped onto the planner's operation model. Argument and directive values are kept as canonical
 * literal text. Instances are single-use; create one per document.
 */
public class OperationParser {

  /** Default bound on selection nesting accepted by the parser. */
  public static final int DEFAULT_MAX_DEPTH = 128;

  private final int maxDepth;
  private int depth;

  private OperationParser(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  /**
   * Parses an executable document.
   *
   * @param source document text
   * @return the parsed document
   * @throws InvalidOperationException on syntax errors
   */
  public static Document parseDocument(String source) {
    return parseDocument(source, DEFAULT_MAX_DEPTH);
  }

  /** Parses an executable document, rejecting selections nested deeper than {@code maxDepth}. */
  public static Document parseDocument(String source, int maxDepth) {
    return new OperationParser(maxDepth).document(parseAst(source));
  }

  /**
   * Parses a field set such as {@code "id organization { id }"}.
   *
   * @param source field set text, without enclosing braces
   * @return the selections, with no parent type
   * @throws InvalidOperationException on syntax errors or an empty field set
   */
  public static SelectionSet parseFieldSet(String source) {
    if (Strings.isNullOrEmpty(source) || source.isBlank()) {
      throw new InvalidOperationException("Field set must not be empty");
    }
    graphql.language.Document ast = parseAst("{" + source + "}");
    List<Definition> definitions = ast.getDefinitions();
    if (definitions.size() != 1 || !(definitions.get(0) instanceof OperationDefinition)) {
      throw new InvalidOperationException("Invalid field set: " + source);
    }
    OperationDefinition definition = (OperationDefinition) definitions.get(0);
    return new OperationParser(DEFAULT_MAX_DEPTH).selectionSet(definition.getSelectionSet());
  }

  private static graphql.language.Document parseAst(String source) {
    try {
      return Parser.parse(Strings.nullToEmpty(source));
    } catch (InvalidSyntaxException e) {
      SourceLocation location = e.getLocation();
      throw new InvalidOperationException(
          location == null
              ? "Syntax error: " + e.getMessage()
              : String.format(
                  "Syntax error at line %d, column %d: %s",
                  location.getLine(), location.getColumn(), e.getMessage()));
    }
  }

  private Document document(graphql.language.Document ast) {
    List<Operation> operations = new ArrayList<>();
    Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();
    for (Definition<?> definition : ast.getDefinitions()) {
      if (definition instanceof OperationDefinition) {
        operations.add(operation((OperationDefinition) definition));
      } else if (definition instanceof graphql.language.FragmentDefinition) {
        FragmentDefinition fragment =
            fragmentDefinition((graphql.language.FragmentDefinition) definition);
        if (fragments.put(fragment.getName(), fragment) != null) {
          throw new InvalidOperationException("Duplicate fragment " + fragment.getName());
        }
      } else {
        throw new InvalidOperationException(
            "Unexpected " + definition.getClass().getSimpleName() + " in executable document");
      }
    }
    if (operations.isEmpty()) {
      throw new InvalidOperationException("Document does not contain any operation");
    }
    return new Document(operations, fragments);
  }

  private Operation operation(OperationDefinition definition) {
    OperationType type = OperationType.valueOf(definition.getOperation().name());
    List<VariableDefinition> variables = new ArrayList<>();
    for (graphql.language.VariableDefinition variable : definition.getVariableDefinitions()) {
      Value<?> defaultValue = variable.getDefaultValue();
      variables.add(
          new VariableDefinition(
              variable.getName(),
              typeReference(variable.getType()),
              defaultValue == null ? null : value(defaultValue, new LinkedHashSet<>())));
    }
    return new Operation(
        type, definition.getName(), variables, selectionSet(definition.getSelectionSet()));
  }

  private FragmentDefinition fragmentDefinition(graphql.language.FragmentDefinition definition) {
    return new FragmentDefinition(
        definition.getName(),
        definition.getTypeCondition().getName(),
        selectionSet(definition.getSelectionSet()));
  }

  private static String typeReference(Type<?> type) {
    if (type instanceof NonNullType) {
      return typeReference(((NonNullType) type).getType()) + "!";
    }
    if (type instanceof ListType) {
      return "[" + typeReference(((ListType) type).getType()) + "]";
    }
    return ((TypeName) type).getName();
  }

  private SelectionSet selectionSet(graphql.language.SelectionSet ast) {
    if (++depth > maxDepth) {
      throw new InvalidOperationException(
          "Selection nesting exceeds the maximum depth of " + maxDepth);
    }
    List<Selection> selections = new ArrayList<>();
    for (graphql.language.Selection<?> selection : ast.getSelections()) {
      selections.add(selection(selection));
    }
    depth--;
    return new SelectionSet(null, selections);
  }

  private Selection selection(graphql.language.Selection<?> selection) {
    if (selection instanceof graphql.language.FragmentSpread) {
      return new FragmentSpread(((graphql.language.FragmentSpread) selection).getName());
    }
    if (selection instanceof graphql.language.InlineFragment) {
      graphql.language.InlineFragment fragment = (graphql.language.InlineFragment) selection;
      TypeName typeCondition = fragment.getTypeCondition();
      return new InlineFragment(
          typeCondition == null ? null : typeCondition.getName(),
          directives(fragment.getDirectives(), new LinkedHashSet<>()),
          selectionSet(fragment.getSelectionSet()));
    }
    graphql.language.Field field = (graphql.language.Field) selection;
    Set<String> variables = new LinkedHashSet<>();
    Map<String, String> arguments = new LinkedHashMap<>();
    for (Argument argument : field.getArguments()) {
      arguments.put(argument.getName(), value(argument.getValue(), variables));
    }
    List<String> directives = directives(field.getDirectives(), variables);
    SelectionSet children =
        field.getSelectionSet() == null ? null : selectionSet(field.getSelectionSet());
    return new Field(field.getAlias(), field.getName(), arguments, directives, variables, children);
  }

  private static List<String> directives(List<Directive> directives, Set<String> variables) {
    List<String> result = new ArrayList<>();
    for (Directive directive : directives) {
      StringBuilder text = new StringBuilder("@").append(directive.getName());
      if (!directive.getArguments().isEmpty()) {
        List<String> arguments = new ArrayList<>();
        for (Argument argument : directive.getArguments()) {
          arguments.add(argument.getName() + ": " + value(argument.getValue(), variables));
        }
        text.append('(').append(String.join(", ", arguments)).append(')');
      }
      result.add(text.toString());
    }
    return result;
  }

  private static String value(Value<?> value, Set<String> variables) {
    if (value instanceof VariableReference) {
      String name = ((VariableReference) value).getName();
      variables.add(name);
      return "$" + name;
    }
    if (value instanceof IntValue) {
      return ((IntValue) value).getValue().toString();
    }
    if (value instanceof FloatValue) {
      return ((FloatValue) value).getValue().toString();
    }
    if (value instanceof StringValue) {
      return quote(((StringValue) value).getValue());
    }
    if (value instanceof BooleanValue) {
      return String.valueOf(((BooleanValue) value).isValue());
    }
    if (value instanceof NullValue) {
      return "null";
    }
    if (value instanceof EnumValue) {
      return ((EnumValue) value).getName();
    }
    if (value instanceof ArrayValue) {
      List<String> items = new ArrayList<>();
      for (Value<?> item : ((ArrayValue) value).getValues()) {
        items.add(value(item, variables));
      }
      return "[" + String.join(", ", items) + "]";
    }
    if (value instanceof ObjectValue) {
      List<String> entries = new ArrayList<>();
      for (ObjectField field : ((ObjectValue) value).getObjectFields()) {
        entries.add(field.getName() + ": " + value(field.getValue(), variables));
      }
      return "{" + String.join(", ", entries) + "}";
    }
    throw new InvalidOperationException("Unsupported value " + value.getClass().getSimpleName());
  }

  /** Renders a string as a single-line GraphQL string literal. Block strings are flattened. */
  private static String quote(String text) {
    StringBuilder out = new StringBuilder("\"");
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '"':
          out.append("\\\"");
          break;
        case '\\':
          out.append("\\\\");
          break;
        case '\n':
          out.append("\\n");
          break;
        case '\r':
          out.append("\\r");
          break;
        case '\t':
          out.append("\\t");
          break;
        case '\b':
          out.append("\\b");
          break;
        case '\f':
          out.append("\\f");
          break;
        default:
          if (c < 0x20) {
            out.append(String.format("\\u%04x", (int) c));
          } else {
            out.append(c);
          }
      }
    }
    return out.append('"').toString();
  }
}
