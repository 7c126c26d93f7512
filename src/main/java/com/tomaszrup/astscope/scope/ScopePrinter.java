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

import com.tomaszrup.astscope.source.SourceManager;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * Renders scopes as text for diagnostics: kind, identity, cached range in
 * {@code line:column} form, and a payload description.
 */
public final class ScopePrinter {
	private static final String INDENT = "  ";

	private ScopePrinter() {
	}

	/**
	 * Describes a single scope on one line. Without a source manager the
	 * range is shown as raw buffer offsets.
	 */
	public static String describe(ASTScopeImpl scope, SourceManager sourceManager) {
		StringBuilder builder = new StringBuilder();
		builder.append(scope.getClassName())
				.append(" 0x").append(Integer.toHexString(System.identityHashCode(scope)))
				.append(' ');
		if (!scope.isSourceRangeCached()) {
			builder.append("<uncached>");
		} else {
			SourceRange range = scope.getSourceRange(true);
			builder.append(sourceManager != null ? sourceManager.getDisplayString(range) : range.toString());
		}
		String description = scope.getDescription();
		if (!description.isEmpty()) {
			builder.append(' ').append(description);
		}
		return builder.toString();
	}

	public static void print(ASTScopeImpl scope, SourceManager sourceManager, StringBuilder out) {
		out.append(describe(scope, sourceManager)).append('\n');
	}

	/**
	 * Prints {@code root} and its subtree, one scope per line, children
	 * indented below their parent.
	 */
	public static String printTree(ASTScopeImpl root) {
		StringBuilder out = new StringBuilder();
		printTree(root, root.getSourceManager(), 0, out);
		return out.toString();
	}

	private static void printTree(ASTScopeImpl scope, SourceManager sourceManager, int depth, StringBuilder out) {
		for (int i = 0; i < depth; i++) {
			out.append(INDENT);
		}
		print(scope, sourceManager, out);
		for (ASTScopeImpl child : scope.getChildren()) {
			printTree(child, sourceManager, depth + 1, out);
		}
	}
}
