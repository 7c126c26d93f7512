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
import java.util.Collections;
import java.util.List;

import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

public abstract class Decl extends ASTNode {
	private final List<DeclAttribute> attributes = new ArrayList<>();

	protected Decl(SourceLoc startLoc, SourceLoc endLoc) {
		super(startLoc, endLoc);
	}

	/**
	 * The location that identifies the declaration, usually its name.
	 */
	public SourceLoc getLoc() {
		return getStartLoc();
	}

	public void addAttribute(DeclAttribute attribute) {
		attributes.add(attribute);
	}

	public List<DeclAttribute> getAttributes() {
		return Collections.unmodifiableList(attributes);
	}

	/**
	 * Returns the declaration's range widened to its attributes, or an
	 * invalid range when the declaration carries no attributes.
	 */
	public SourceRange getSourceRangeIncludingAttrs() {
		if (attributes.isEmpty()) {
			return SourceRange.INVALID;
		}
		SourceRange range = getSourceRange();
		for (DeclAttribute attribute : attributes) {
			range = range.widen(attribute.getRange());
		}
		return range;
	}

	/**
	 * Returns the range spanned by the custom (property wrapper style)
	 * attributes, or an invalid range when there are none.
	 */
	public SourceRange getCustomAttributesSourceRange() {
		SourceRange range = SourceRange.INVALID;
		for (DeclAttribute attribute : attributes) {
			if (attribute instanceof CustomAttr) {
				range = range.widen(attribute.getRange());
			}
		}
		return range;
	}

	@Override
	protected boolean walkToPre(ASTWalker walker) {
		return walker.walkToDeclPre(this);
	}
}
