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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * Base class of every syntax node produced by the parser. Each node records
 * the location of its first token and of its last token.
 */
public abstract class ASTNode {
	private final SourceLoc startLoc;
	private final SourceLoc endLoc;

	protected ASTNode(SourceLoc startLoc, SourceLoc endLoc) {
		this.startLoc = startLoc != null ? startLoc : SourceLoc.INVALID;
		this.endLoc = endLoc != null ? endLoc : SourceLoc.INVALID;
	}

	public SourceLoc getStartLoc() {
		return startLoc;
	}

	public SourceLoc getEndLoc() {
		return endLoc;
	}

	public SourceRange getSourceRange() {
		return new SourceRange(getStartLoc(), getEndLoc());
	}

	/**
	 * Returns the direct sub-nodes of this node in source order. Absent
	 * optional parts are not included.
	 */
	public List<ASTNode> getChildren() {
		return Collections.emptyList();
	}

	/**
	 * Walks this node and its sub-tree in pre-order. A {@code false} answer
	 * from the walker skips the sub-tree below the node it was asked about.
	 */
	public final void walk(ASTWalker walker) {
		if (!walkToPre(walker)) {
			return;
		}
		for (ASTNode child : getChildren()) {
			child.walk(walker);
		}
	}

	protected abstract boolean walkToPre(ASTWalker walker);

	/**
	 * Flattens nodes and collections of nodes into a child list, skipping
	 * nulls.
	 */
	protected static List<ASTNode> childrenOf(Object... parts) {
		List<ASTNode> children = new ArrayList<>();
		for (Object part : parts) {
			if (part instanceof ASTNode) {
				children.add((ASTNode) part);
			} else if (part instanceof Collection) {
				for (Object element : (Collection<?>) part) {
					if (element instanceof ASTNode) {
						children.add((ASTNode) element);
					}
				}
			}
		}
		return children;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + getSourceRange();
	}
}
