/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.impactupgrade.donorsync.util.Utils.nullToEmptyString;

/**
 * One row of the master registry. Same fields as a normalized batch record, but the facility is called the center.
 */
public class MasterRecord {

  public String donorNumber;
  public String firstName;
  public String lastName;
  public String email;
  public String account;
  public String phone;
  public String address;
  public String zipCode;
  public String status;
  public String center;
  public String birthdate;

  public MasterRecord() {}

  // Keep this up to date! Mirrors the registry's column order, helpful for mapping.
  public MasterRecord(String donorNumber, String firstName, String lastName, String email, String account,
      String phone, String address, String zipCode, String status, String center) {
    this.donorNumber = donorNumber;
    this.firstName = firstName;
    this.lastName = lastName;
    this.email = email;
    this.account = account;
    this.phone = phone;
    this.address = address;
    this.zipCode = zipCode;
    this.status = status;
    this.center = center;
  }

  public static MasterRecord from(DonorRecord record) {
    MasterRecord master = new MasterRecord(record.donorNumber, record.firstName, record.lastName, record.email,
        record.account, record.phone, record.address, record.zipCode, record.status, record.facility);
    master.birthdate = record.birthdate;
    return master;
  }

  /**
   * Reads a registry row positionally. Short rows are padded, so a row written without a trailing birthdate simply
   * has none.
   */
  public static MasterRecord fromRow(List<?> row, boolean withBirthdate) {
    MasterRecord master = new MasterRecord(
        cell(row, 0), cell(row, 1), cell(row, 2), cell(row, 3), cell(row, 4),
        cell(row, 5), cell(row, 6), cell(row, 7), cell(row, 8), cell(row, 9));
    if (withBirthdate) {
      master.birthdate = cell(row, 10);
    }
    return master;
  }

  public List<String> toRow(boolean withBirthdate) {
    List<String> row = new ArrayList<>(List.of(
        nullToEmptyString(donorNumber), nullToEmptyString(firstName), nullToEmptyString(lastName),
        nullToEmptyString(email), nullToEmptyString(account), nullToEmptyString(phone), nullToEmptyString(address),
        nullToEmptyString(zipCode), nullToEmptyString(status), nullToEmptyString(center)));
    if (withBirthdate) {
      row.add(nullToEmptyString(birthdate));
    }
    return row;
  }

  public String compositeKey() {
    return DonorRecord.compositeKey(donorNumber, center);
  }

  public String matchKey() {
    return DonorRecord.matchKey(donorNumber, center);
  }

  private static String cell(List<?> row, int index) {
    if (row == null || index >= row.size() || row.get(index) == null) {
      return "";
    }
    return row.get(index).toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    MasterRecord that = (MasterRecord) o;
    return Objects.equals(donorNumber, that.donorNumber) && Objects.equals(firstName, that.firstName)
        && Objects.equals(lastName, that.lastName) && Objects.equals(email, that.email)
        && Objects.equals(account, that.account) && Objects.equals(phone, that.phone)
        && Objects.equals(address, that.address) && Objects.equals(zipCode, that.zipCode)
        && Objects.equals(status, that.status) && Objects.equals(center, that.center)
        && Objects.equals(birthdate, that.birthdate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(donorNumber, firstName, lastName, email, account, phone, address, zipCode, status, center,
        birthdate);
  }

  @Override
  public String toString() {
    return "MasterRecord{" + compositeKey() + ", " + firstName + " " + lastName + "}";
  }
}
