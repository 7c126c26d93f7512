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

/**
 * {@code "a \(b) c"}. The parser records the nominal end at the start of the
 * literal's token, so for multi-line literals the closing quote can lie well
 * after {@link #getEndLoc()}.
 */
public class InterpolatedStringLiteralExpr extends Expr {
	private final SourceLoc trailingQuoteLoc;
	private final List<Expr> segments;

	public InterpolatedStringLiteralExpr(SourceLoc startLoc, SourceLoc endLoc, SourceLoc trailingQuoteLoc,
			List<Expr> segments) {
		super(startLoc, endLoc);
		this.trailingQuoteLoc = trailingQuoteLoc != null ? trailingQuoteLoc : SourceLoc.INVALID;
		this.segments = segments != null ? new ArrayList<>(segments) : new ArrayList<>();
	}

	public SourceLoc getTrailingQuoteLoc() {
		return trailingQuoteLoc;
	}

	public List<Expr> getSegments() {
		return Collections.unmodifiableList(segments);
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(segments);
	}
}
