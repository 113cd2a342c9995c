/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.balancer.elements;

/**
 * Enumerates all 118 elements of the periodic table, plus deuterium which shows up often enough in formulae to be
 * accepted as an element of its own.  Masses are standard atomic weights in g/mol.
 */
public enum ChemicalElement implements Element {
  HYDROGEN("H", "Hydrogen", 1, 1.008),
  HELIUM("He", "Helium", 2, 4.003),
  LITHIUM("Li", "Lithium", 3, 6.941),
  BERYLLIUM("Be", "Beryllium", 4, 9.012),
  BORON("B", "Boron", 5, 10.81),
  CARBON("C", "Carbon", 6, 12.01),
  NITROGEN("N", "Nitrogen", 7, 14.01),
  OXYGEN("O", "Oxygen", 8, 16.00),
  FLUORINE("F", "Fluorine", 9, 19.00),
  NEON("Ne", "Neon", 10, 20.18),
  SODIUM("Na", "Sodium", 11, 22.99),
  MAGNESIUM("Mg", "Magnesium", 12, 24.31),
  ALUMINUM("Al", "Aluminum", 13, 26.98),
  SILICON("Si", "Silicon", 14, 28.09),
  PHOSPHORUS("P", "Phosphorus", 15, 30.97),
  SULFUR("S", "Sulfur", 16, 32.07),
  CHLORINE("Cl", "Chlorine", 17, 35.45),
  ARGON("Ar", "Argon", 18, 39.95),
  POTASSIUM("K", "Potassium", 19, 39.10),
  CALCIUM("Ca", "Calcium", 20, 40.08),
  SCANDIUM("Sc", "Scandium", 21, 44.96),
  TITANIUM("Ti", "Titanium", 22, 47.87),
  VANADIUM("V", "Vanadium", 23, 50.94),
  CHROMIUM("Cr", "Chromium", 24, 52.00),
  MANGANESE("Mn", "Manganese", 25, 54.94),
  IRON("Fe", "Iron", 26, 55.85),
  COBALT("Co", "Cobalt", 27, 58.93),
  NICKEL("Ni", "Nickel", 28, 58.69),
  COPPER("Cu", "Copper", 29, 63.55),
  ZINC("Zn", "Zinc", 30, 65.38),
  GALLIUM("Ga", "Gallium", 31, 69.72),
  GERMANIUM("Ge", "Germanium", 32, 72.64),
  ARSENIC("As", "Arsenic", 33, 74.92),
  SELENIUM("Se", "Selenium", 34, 78.97),
  BROMINE("Br", "Bromine", 35, 79.90),
  KRYPTON("Kr", "Krypton", 36, 83.80),
  RUBIDIUM("Rb", "Rubidium", 37, 85.47),
  STRONTIUM("Sr", "Strontium", 38, 87.62),
  YTTRIUM("Y", "Yttrium", 39, 88.91),
  ZIRCONIUM("Zr", "Zirconium", 40, 91.22),
  NIOBIUM("Nb", "Niobium", 41, 92.91),
  MOLYBDENUM("Mo", "Molybdenum", 42, 95.95),
  TECHNETIUM("Tc", "Technetium", 43, 98.00),
  RUTHENIUM("Ru", "Ruthenium", 44, 101.1),
  RHODIUM("Rh", "Rhodium", 45, 102.9),
  PALLADIUM("Pd", "Palladium", 46, 106.4),
  SILVER("Ag", "Silver", 47, 107.9),
  CADMIUM("Cd", "Cadmium", 48, 112.4),
  INDIUM("In", "Indium", 49, 114.8),
  TIN("Sn", "Tin", 50, 118.7),
  ANTIMONY("Sb", "Antimony", 51, 121.8),
  TELLURIUM("Te", "Tellurium", 52, 127.6),
  IODINE("I", "Iodine", 53, 126.9),
  XENON("Xe", "Xenon", 54, 131.3),
  CESIUM("Cs", "Cesium", 55, 132.9),
  BARIUM("Ba", "Barium", 56, 137.3),
  LANTHANUM("La", "Lanthanum", 57, 138.9),
  CERIUM("Ce", "Cerium", 58, 140.1),
  PRASEODYMIUM("Pr", "Praseodymium", 59, 140.9),
  NEODYMIUM("Nd", "Neodymium", 60, 144.2),
  PROMETHIUM("Pm", "Promethium", 61, 145.0),
  SAMARIUM("Sm", "Samarium", 62, 150.4),
  EUROPIUM("Eu", "Europium", 63, 152.0),
  GADOLINIUM("Gd", "Gadolinium", 64, 157.3),
  TERBIUM("Tb", "Terbium", 65, 158.9),
  DYSPROSIUM("Dy", "Dysprosium", 66, 162.5),
  HOLMIUM("Ho", "Holmium", 67, 164.9),
  ERBIUM("Er", "Erbium", 68, 167.3),
  THULIUM("Tm", "Thulium", 69, 168.9),
  YTTERBIUM("Yb", "Ytterbium", 70, 173.0),
  LUTETIUM("Lu", "Lutetium", 71, 175.0),
  HAFNIUM("Hf", "Hafnium", 72, 178.5),
  TANTALUM("Ta", "Tantalum", 73, 180.9),
  TUNGSTEN("W", "Tungsten", 74, 183.8),
  RHENIUM("Re", "Rhenium", 75, 186.2),
  OSMIUM("Os", "Osmium", 76, 190.2),
  IRIDIUM("Ir", "Iridium", 77, 192.2),
  PLATINUM("Pt", "Platinum", 78, 195.1),
  GOLD("Au", "Gold", 79, 197.0),
  MERCURY("Hg", "Mercury", 80, 200.6),
  THALLIUM("Tl", "Thallium", 81, 204.4),
  LEAD("Pb", "Lead", 82, 207.2),
  BISMUTH("Bi", "Bismuth", 83, 209.0),
  POLONIUM("Po", "Polonium", 84, 209.0),
  ASTATINE("At", "Astatine", 85, 210.0),
  RADON("Rn", "Radon", 86, 222.0),
  FRANCIUM("Fr", "Francium", 87, 223.0),
  RADIUM("Ra", "Radium", 88, 226.0),
  ACTINIUM("Ac", "Actinium", 89, 227.0),
  THORIUM("Th", "Thorium", 90, 232.0),
  PROTACTINIUM("Pa", "Protactinium", 91, 231.0),
  URANIUM("U", "Uranium", 92, 238.0),
  NEPTUNIUM("Np", "Neptunium", 93, 237.0),
  PLUTONIUM("Pu", "Plutonium", 94, 244.0),
  AMERICIUM("Am", "Americium", 95, 243.0),
  CURIUM("Cm", "Curium", 96, 247.0),
  BERKELIUM("Bk", "Berkelium", 97, 247.0),
  CALIFORNIUM("Cf", "Californium", 98, 251.0),
  EINSTEINIUM("Es", "Einsteinium", 99, 252.0),
  FERMIUM("Fm", "Fermium", 100, 257.0),
  MENDELEVIUM("Md", "Mendelevium", 101, 258.0),
  NOBELIUM("No", "Nobelium", 102, 259.0),
  LAWRENCIUM("Lr", "Lawrencium", 103, 262.0),
  RUTHERFORDIUM("Rf", "Rutherfordium", 104, 267.0),
  DUBNIUM("Db", "Dubnium", 105, 268.0),
  SEABORGIUM("Sg", "Seaborgium", 106, 269.0),
  BOHRIUM("Bh", "Bohrium", 107, 270.0),
  HASSIUM("Hs", "Hassium", 108, 277.0),
  MEITNERIUM("Mt", "Meitnerium", 109, 278.0),
  DARMSTADTIUM("Ds", "Darmstadtium", 110, 281.0),
  ROENTGENIUM("Rg", "Roentgenium", 111, 282.0),
  COPERNICIUM("Cn", "Copernicium", 112, 285.0),
  NIHONIUM("Nh", "Nihonium", 113, 286.0),
  FLEROVIUM("Fl", "Flerovium", 114, 289.0),
  MOSCOVIUM("Mc", "Moscovium", 115, 290.0),
  LIVERMORIUM("Lv", "Livermorium", 116, 293.0),
  TENNESSINE("Ts", "Tennessine", 117, 294.0),
  OGANESSON("Og", "Oganesson", 118, 294.0),
  DEUTERIUM("D", "Deuterium", 1, 2.014),
  ;

  private final String symbol;
  private final String name;
  private final Integer atomicNumber;
  private final Double atomicMass;

  ChemicalElement(String symbol, String name, Integer atomicNumber, Double atomicMass) {
    this.symbol = symbol;
    this.name = name;
    this.atomicNumber = atomicNumber;
    this.atomicMass = atomicMass;
  }

  @Override
  public String getSymbol() {
    return this.symbol;
  }

  @Override
  public String getName() {
    return this.name;
  }

  @Override
  public Integer getAtomicNumber() {
    return this.atomicNumber;
  }

  @Override
  public Double getAtomicMass() {
    return this.atomicMass;
  }
}
