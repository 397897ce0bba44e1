/*
 * どこで: Profile エラー定義
 * 何を: コア層が呼び出し元へ返す失敗の分類
 * なぜ: 輸送層が HTTP/gRPC ステータスへ一貫して変換できるようにするため
 */
package com.example.profile.error;

public enum ErrorCode {
  NOT_FOUND,
  VALIDATION_ERROR,
  CONFLICT,
  UNAVAILABLE
}
