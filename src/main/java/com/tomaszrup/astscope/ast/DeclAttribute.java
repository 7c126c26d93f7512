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

import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * An attribute written on a declaration, from its {@code @} to the end of
 * its argument clause.
 */
public class DeclAttribute {
	private final String name;
	private final SourceRange range;

	public DeclAttribute(String name, SourceLoc atLoc, SourceLoc endLoc) {
		this.name = name;
		this.range = new SourceRange(atLoc, endLoc);
	}

	public String getName() {
		return name;
	}

	public SourceRange getRange() {
		return range;
	}

	@Override
	public String toString() {
		return "@" + name + range;
	}
}
