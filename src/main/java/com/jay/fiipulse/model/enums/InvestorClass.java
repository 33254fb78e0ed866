package com.jay.fiipulse.model.enums;

public enum InvestorClass {
    FII,    // Foreign Institutional / Portfolio Investor
    DII     // Domestic Institutional Investor (MF, insurance, pension)
}
