////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.astscope.ast;

import java.util.List;

import com.tomaszrup.astscope.source.SourceLoc;

/**
 * One comma-separated element of an {@code if}, {@code while} or
 * {@code guard} condition.
 */
public final class StmtConditionElement {
	public enum ConditionKind {
		/** {@code x > 0} */
		BOOLEAN,
		/** {@code #available(macOS 10.15, *)} */
		AVAILABILITY,
		/** {@code let x = f()} */
		PATTERN_BINDING
	}

	private final ConditionKind kind;
	private final SourceLoc startLoc;
	private final SourceLoc endLoc;
	private final Expr booleanExpr;
	private final Pattern pattern;
	private final Expr initializer;

	private StmtConditionElement(ConditionKind kind, SourceLoc startLoc, SourceLoc endLoc, Expr booleanExpr,
			Pattern pattern, Expr initializer) {
		this.kind = kind;
		this.startLoc = startLoc;
		this.endLoc = endLoc;
		this.booleanExpr = booleanExpr;
		this.pattern = pattern;
		this.initializer = initializer;
	}

	public static StmtConditionElement forBoolean(Expr condition) {
		return new StmtConditionElement(ConditionKind.BOOLEAN, condition.getStartLoc(), condition.getEndLoc(),
				condition, null, null);
	}

	public static StmtConditionElement forAvailability(SourceLoc startLoc, SourceLoc endLoc) {
		return new StmtConditionElement(ConditionKind.AVAILABILITY, startLoc, endLoc, null, null, null);
	}

	/**
	 * @param initializer the bound value, or {@code null} for the shorthand
	 *                    {@code if let x}, which ends with its pattern
	 */
	public static StmtConditionElement forPatternBinding(SourceLoc introducerLoc, Pattern pattern, Expr initializer) {
		SourceLoc endLoc = initializer != null ? initializer.getEndLoc() : pattern.getEndLoc();
		return new StmtConditionElement(ConditionKind.PATTERN_BINDING, introducerLoc, endLoc, null, pattern,
				initializer);
	}

	public ConditionKind getKind() {
		return kind;
	}

	public SourceLoc getStartLoc() {
		return startLoc;
	}

	public SourceLoc getEndLoc() {
		return endLoc;
	}

	public Expr getBoolean() {
		return booleanExpr;
	}

	public Pattern getPattern() {
		return pattern;
	}

	public Expr getInitializer() {
		return initializer;
	}

	List<ASTNode> getNodes() {
		return ASTNode.childrenOf(booleanExpr, pattern, initializer);
	}
}
