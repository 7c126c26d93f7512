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
package com.tomaszrup.astscope.scope;

import com.tomaszrup.astscope.ast.ASTNode;
import com.tomaszrup.astscope.ast.ASTWalker;
import com.tomaszrup.astscope.ast.EditorPlaceholderExpr;
import com.tomaszrup.astscope.ast.Expr;
import com.tomaszrup.astscope.ast.InterpolatedStringLiteralExpr;
import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * Finds where an expression really ends. Interpolated string literals and
 * editor placeholders report a nominal end that can precede their closing
 * quote or angle bracket, so every expression in the sub-tree is visited and
 * the furthest such trailing location is kept.
 */
class EffectiveEndFinder implements ASTWalker {
	private SourceLoc end = SourceLoc.INVALID;

	/**
	 * Declarations and statements use their plain range. Expressions span
	 * from their start to the later of their own end and the furthest
	 * trailing quote or angle bracket nested inside them.
	 */
	static SourceRange getEffectiveSourceRange(ASTNode node) {
		if (!(node instanceof Expr)) {
			return node.getSourceRange();
		}
		EffectiveEndFinder finder = new EffectiveEndFinder();
		node.walk(finder);
		SourceLoc effectiveEnd = node.getEndLoc();
		SourceLoc trailing = finder.getTrailingLoc();
		if (trailing.isValid() && (effectiveEnd.isInvalid() || SourceLoc.COMPARATOR.compare(effectiveEnd, trailing) < 0)) {
			effectiveEnd = trailing;
		}
		return new SourceRange(node.getStartLoc(), effectiveEnd);
	}

	@Override
	public boolean walkToExprPre(Expr expr) {
		if (expr instanceof InterpolatedStringLiteralExpr) {
			widenEnd(((InterpolatedStringLiteralExpr) expr).getTrailingQuoteLoc());
		} else if (expr instanceof EditorPlaceholderExpr) {
			widenEnd(((EditorPlaceholderExpr) expr).getTrailingAngleBracketLoc());
		}
		return true;
	}

	private void widenEnd(SourceLoc candidate) {
		if (candidate.isInvalid()) {
			return;
		}
		if (end.isInvalid() || SourceLoc.COMPARATOR.compare(end, candidate) < 0) {
			end = candidate;
		}
	}

	SourceLoc getTrailingLoc() {
		return end;
	}
}
