// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.autodep.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/** Syntax node for a function call expression, such as a rule declaration. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final ExpressionList arguments;

  CallExpression(Token lparen, Expression function, ExpressionList arguments) {
    super(lparen, Kind.CALL);
    this.function = function;
    this.arguments = arguments;
  }

  /** Returns a call of the named rule or builtin, with arguments laid out as a new list. */
  public static CallExpression of(String functionName, List<? extends Expression> arguments) {
    return new CallExpression(
        Token.synthetic(TokenKind.LPAREN, "(", null),
        Identifier.ruleName(functionName),
        ExpressionList.of(arguments));
  }

  public Expression getFunction() {
    return function;
  }

  /**
   * Returns the name of the called function: the identifier, or the source text of a selector such
   * as {@code native.filegroup}.
   */
  public String getFunctionName() {
    return function instanceof Identifier ? ((Identifier) function).getName() : function.toString();
  }

  public ExpressionList getArguments() {
    return arguments;
  }

  /** Returns the keyword arguments {@code key = value}, in order. */
  public ImmutableList<InfixExpression> getKeywordArguments() {
    ImmutableList.Builder<InfixExpression> result = ImmutableList.builder();
    for (Expression arg : arguments.getElements()) {
      if (arg instanceof InfixExpression && ((InfixExpression) arg).isKeywordArgument()) {
        result.add((InfixExpression) arg);
      }
    }
    return result.build();
  }

  /** Returns the first keyword argument with the given name, or null. */
  @Nullable
  public InfixExpression getKeywordArgument(String name) {
    for (InfixExpression arg : getKeywordArguments()) {
      if (arg.getKeywordName().equals(name)) {
        return arg;
      }
    }
    return null;
  }

  @Override
  public CallExpression deepCopy() {
    return copyDecorationsTo(
        new CallExpression(getToken(), function.deepCopy(), arguments.deepCopy()));
  }
}
