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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.astscope.source.SourceManager;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * Checks the two invariants of cached scope ranges:
 * <ol>
 *   <li>the span from the first to the last child lies inside the parent;</li>
 *   <li>a scope starts no earlier than its prior sibling ends.</li>
 * </ol>
 * A violation is logged with the offending scopes and raised as a
 * {@link ScopeVerificationError}.
 */
class ScopeRangeVerifier {
	private static final Logger logger = LoggerFactory.getLogger(ScopeRangeVerifier.class);

	private final SourceManager sourceManager;

	ScopeRangeVerifier(SourceManager sourceManager) {
		this.sourceManager = sourceManager;
	}

	boolean verify(ASTScopeImpl scope) {
		return verifyThatChildrenAreContained(scope) && verifyThatThisNodeComesAfterItsPriorSibling(scope);
	}

	// assumes children are already in order
	boolean verifyThatChildrenAreContained(ASTScopeImpl scope) {
		List<ASTScopeImpl> children = scope.getChildren();
		if (children.isEmpty()) {
			return true;
		}
		ASTScopeImpl first = children.get(0);
		ASTScopeImpl last = children.get(children.size() - 1);
		// out-of-order children are left to the sibling check
		SourceRange rangeOfChildren = first.getSourceRange().widen(last.getSourceRange());
		if (sourceManager.rangeContains(scope.getSourceRange(), rangeOfChildren)) {
			return true;
		}
		StringBuilder out = new StringBuilder("children not contained in its parent\n");
		if (children.size() == 1) {
			out.append("\n***Only Child node***\n");
			ScopePrinter.print(first, sourceManager, out);
		} else {
			out.append("\n***First Child node***\n");
			ScopePrinter.print(first, sourceManager, out);
			out.append("\n***Last Child node***\n");
			ScopePrinter.print(last, sourceManager, out);
		}
		out.append("\n***Parent node***\n");
		ScopePrinter.print(scope, sourceManager, out);
		throw fail(ScopeVerificationError.Violation.CHILDREN_NOT_CONTAINED, out);
	}

	boolean verifyThatThisNodeComesAfterItsPriorSibling(ASTScopeImpl scope) {
		ASTScopeImpl priorSibling = scope.getPriorSibling();
		if (priorSibling == null) {
			return true;
		}
		if (priorSibling.precedesInSource(scope)) {
			return true;
		}
		StringBuilder out = new StringBuilder("unexpected out-of-order nodes\n");
		out.append("\n***Penultimate child node***\n");
		ScopePrinter.print(priorSibling, sourceManager, out);
		out.append("\n***Last Child node***\n");
		ScopePrinter.print(scope, sourceManager, out);
		out.append("\n***Parent node***\n");
		ScopePrinter.print(scope.getParent(), sourceManager, out);
		throw fail(ScopeVerificationError.Violation.OUT_OF_ORDER_SIBLINGS, out);
	}

	private static ScopeVerificationError fail(ScopeVerificationError.Violation violation, StringBuilder report) {
		String message = "Scope range verification failed: " + report;
		logger.error(message);
		return new ScopeVerificationError(violation, message);
	}
}
