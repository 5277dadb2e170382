// Copyright 2026 The LWG Project Developers
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
package lwg.lang;

/**
 * A GOTO program whose labels are broken: a label is defined twice, or a
 * jump names a label that is not defined.
 */
@SuppressWarnings("serial")
public class StructureError extends ProgramError {

	public StructureError(String message, SyntacticItem loc) {
		super(message, loc);
	}
}
