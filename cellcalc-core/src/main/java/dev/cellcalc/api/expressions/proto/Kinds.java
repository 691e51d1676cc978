/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.cellcalc.api.expressions.proto;

import dev.cellcalc.api.Coordinate;
import dev.cellcalc.api.expressions.*;
import dev.cellcalc.proto.ExprProtos;

final class Kinds {
    private Kinds() {}

    static ExprProtos.Kind literal(Literal lit) {
        return ExprProtos.Kind.newBuilder()
                .setLiteral(ExprProtos.Kind.Literal.newBuilder()
                        .setValue(lit.getValue().accept(ValueToScalar.INSTANCE))
                        .build())
                .build();
    }

    static ExprProtos.Kind cellReference(CellReference cellReference) {
        Coordinate coordinate = cellReference.getCoordinate();
        return ExprProtos.Kind.newBuilder()
                .setCellReference(ExprProtos.Kind.CellReference.newBuilder()
                        .setCoordinate(ExprProtos.Coordinate.newBuilder()
                                .setRow(coordinate.row())
                                .setCol(coordinate.col())
                                .build())
                        .build())
                .build();
    }

    static ExprProtos.Kind binary(Binary binary) {
        ExprProtos.Kind.BinaryOp op;
        switch (binary.getOperator()) {
            case ADD:
                op = ExprProtos.Kind.BinaryOp.Add;
                break;
            case SUBTRACT:
                op = ExprProtos.Kind.BinaryOp.Subtract;
                break;
            case MULTIPLY:
                op = ExprProtos.Kind.BinaryOp.Multiply;
                break;
            case DIVIDE:
                op = ExprProtos.Kind.BinaryOp.Divide;
                break;
            case REMAINDER:
                op = ExprProtos.Kind.BinaryOp.Remainder;
                break;
            case POWER:
                op = ExprProtos.Kind.BinaryOp.Power;
                break;
            default:
                throw new IllegalArgumentException("Unsupported binary operator: " + binary.getOperator());
        }

        return ExprProtos.Kind.newBuilder().setBinaryOp(op).build();
    }
}
