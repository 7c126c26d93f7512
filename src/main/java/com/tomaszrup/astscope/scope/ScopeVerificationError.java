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

/**
 * Raised when a cached scope range breaks the containment or sibling-order
 * invariant. The scope tree was built wrongly and cannot be trusted for any
 * later lookup, so this is an {@link Error}: callers are not expected to
 * recover from it.
 */
public class ScopeVerificationError extends Error {
	private static final long serialVersionUID = 1L;

	public enum Violation {
		CHILDREN_NOT_CONTAINED, OUT_OF_ORDER_SIBLINGS
	}

	private final Violation violation;

	public ScopeVerificationError(Violation violation, String report) {
		super(report);
		this.violation = violation;
	}

	public Violation getViolation() {
		return violation;
	}
}
